package com.cstfs.app.inventory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deletes files on behalf of duplicate resolution. A file that is already
 * gone counts as removed; any other failure is reported to the caller.
 */
public class FileRemover {

    private static final Logger logger = LoggerFactory.getLogger(FileRemover.class);

    public void remove(Path file) throws IOException {
        try {
            if (!Files.deleteIfExists(file)) {
                logger.debug("File already absent: {}", file);
            }
        } catch (IOException e) {
            throw new IOException("Could not remove path " + file, e);
        }
    }
}
