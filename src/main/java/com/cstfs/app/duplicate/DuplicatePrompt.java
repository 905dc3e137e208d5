package com.cstfs.app.duplicate;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cstfs.app.database.ContentIndex;
import com.cstfs.app.database.DuplicateInsertionException;
import com.cstfs.app.inventory.FileRemover;

/**
 * Blocking operator prompt run when a file's hash is already indexed under
 * another path. Reads one line per answer until a terminal command arrives.
 */
public class DuplicatePrompt {

    private static final Logger logger = LoggerFactory.getLogger(DuplicatePrompt.class);

    private final BufferedReader in;
    private final PrintStream out;
    private final FileRemover remover;

    public DuplicatePrompt(BufferedReader in, PrintStream out, FileRemover remover) {
        this.in = in;
        this.out = out;
        this.remover = remover;
    }

    /**
     * Asks what to do with {@code duplicate} and applies the answer.
     *
     * @return the terminal command that was applied
     * @throws RunAbortedException           on {@code n}
     * @throws UnsupportedOperationException on {@code s}
     * @throws IOException                   when input ends or a delete fails
     */
    public Command resolve(Path root, DuplicateInsertionException duplicate, ContentIndex index) throws IOException {
        String oldPath = duplicate.existingPath();
        String newPath = duplicate.newPath();

        out.print("Found path \"" + newPath + "\", duplicate of \"" + oldPath
            + "\", would you like to remove it? (" + Command.VALID_COMMANDS + "): ");
        out.flush();

        while (true) {
            String line = in.readLine();
            if (line == null) {
                throw new IOException("Input closed while resolving duplicate " + newPath);
            }
            out.println();

            Command command = Command.parse(line);
            switch (command) {
                case REMOVE_NEW -> {
                    remover.remove(root.resolve(newPath));
                    out.println("Removed file " + newPath);
                    out.println();
                    out.flush();
                    logger.info("Duplicate {} of {} removed", newPath, oldPath);
                    return command;
                }
                case ABORT -> {
                    out.println("Quitting...");
                    out.flush();
                    throw new RunAbortedException("Aborted by operator at duplicate " + newPath);
                }
                case IGNORE -> throw new UnsupportedOperationException(
                    "Adding a file to the ignore list is not implemented");
                case REMOVE_OLD -> {
                    // Rebind before deleting so a failed update leaves both files on disk.
                    index.rebindPath(newPath, duplicate.hash());
                    remover.remove(root.resolve(oldPath));
                    out.println("Removed file " + oldPath);
                    out.println("Updated index with " + newPath);
                    out.println();
                    out.flush();
                    logger.info("Original {} removed, index now points at {}", oldPath, newPath);
                    return command;
                }
                case HELP -> out.println(Command.HELP_TEXT);
                case INVALID -> out.println("Invalid command, valid ones are (" + Command.VALID_COMMANDS + ")");
            }
            out.flush();
        }
    }
}
