package com.cstfs.app.inventory;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class FileRemoverTest {

    private final FileRemover remover = new FileRemover();

    @Test
    void removesExistingFile() throws Exception {
        Path dir = Files.createTempDirectory("cstfs-remove-");
        Path f = Files.writeString(dir.resolve("a.jpg"), "a");

        remover.remove(f);
        assertFalse(Files.exists(f));
    }

    @Test
    void absentFileCountsAsRemoved() throws Exception {
        Path dir = Files.createTempDirectory("cstfs-remove-");
        assertDoesNotThrow(() -> remover.remove(dir.resolve("never-there.jpg")));
    }

    @Test
    void otherFailuresAreReportedWithThePath() throws Exception {
        Path dir = Files.createTempDirectory("cstfs-remove-");
        Path busy = Files.createDirectories(dir.resolve("album.jpg"));
        Files.writeString(busy.resolve("inside.jpg"), "keeps the directory non-empty");

        IOException e = assertThrows(IOException.class, () -> remover.remove(busy));
        assertTrue(e.getMessage().contains("album.jpg"), e.getMessage());
        assertTrue(Files.exists(busy.resolve("inside.jpg")));
    }
}
