package com.cstfs.app.inventory;

import com.cstfs.app.database.ContentIndex;
import com.cstfs.app.database.IndexEntry;
import com.cstfs.app.database.IndexStore;
import com.cstfs.app.duplicate.DuplicatePrompt;
import com.cstfs.app.duplicate.RunAbortedException;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class IndexBuilderTest {

    private final ByteArrayOutputStream promptOut = new ByteArrayOutputStream();

    private IndexBuilder builder(String operatorInput) {
        DirectoryScanner scanner = DirectoryScanner.forExtensions(Set.of("jpg"), "cstfs.db");
        DuplicatePrompt prompt = new DuplicatePrompt(
            new BufferedReader(new StringReader(operatorInput)),
            new PrintStream(promptOut, true, StandardCharsets.UTF_8),
            new FileRemover());
        return new IndexBuilder(scanner, new ContentHasher(), prompt);
    }

    private static Path treeWithDuplicate() throws Exception {
        Path root = Files.createTempDirectory("cstfs-build-");
        Files.writeString(root.resolve("a.jpg"), "same bytes");
        Files.writeString(root.resolve("b.jpg"), "same bytes");
        Files.writeString(root.resolve("c.jpg"), "other bytes");
        return root;
    }

    private static List<String> indexedPaths(IndexStore store) {
        return store.read(ContentIndex::scanAll).stream().map(IndexEntry::path).sorted().toList();
    }

    @Test
    void indexesEveryEligibleFileOnce() throws Exception {
        Path root = Files.createTempDirectory("cstfs-build-");
        Files.createDirectories(root.resolve("sub"));
        Files.writeString(root.resolve("a.jpg"), "a");
        Files.writeString(root.resolve("sub/b.jpg"), "b");
        Files.writeString(root.resolve("skip.txt"), "t");

        List<String> console = new ArrayList<>();
        try (IndexStore store = IndexStore.open(root, "cstfs.db")) {
            IndexBuilder.BuildMetrics m = builder("").build(root, store, console::add);

            assertEquals(2, m.filesSeen.sum());
            assertEquals(2, m.filesInserted.sum());
            assertEquals(0, m.duplicatesFound.sum());
            assertEquals(List.of("a.jpg", "sub/b.jpg"), indexedPaths(store));
        }
        assertTrue(console.contains("Adding file 1/2..."));
        assertTrue(console.contains("Adding file 2/2..."));
        assertTrue(console.get(console.size() - 1).startsWith("Done generating database at"));
    }

    @Test
    void rebuildReplacesEntriesThatNoLongerExist() throws Exception {
        Path root = Files.createTempDirectory("cstfs-build-");
        Files.writeString(root.resolve("a.jpg"), "a");

        try (IndexStore store = IndexStore.open(root, "cstfs.db")) {
            store.inTransaction(index -> {
                index.insert("gone.jpg", "00000000000000ff");
                return null;
            });

            builder("").build(root, store, s -> {}, true);
            assertEquals(List.of("a.jpg"), indexedPaths(store));
        }
    }

    @Test
    void failedRebuildKeepsTheOldEntries() throws Exception {
        Path root = treeWithDuplicate();

        try (IndexStore store = IndexStore.open(root, "cstfs.db")) {
            store.inTransaction(index -> {
                index.insert("old.jpg", "00000000000000ff");
                return null;
            });

            assertThrows(RunAbortedException.class, () -> builder("n\n").build(root, store, s -> {}, true));
            assertEquals(List.of("old.jpg"), indexedPaths(store));
        }
    }

    @Test
    void answeringYesRemovesTheNewFile() throws Exception {
        Path root = treeWithDuplicate();

        try (IndexStore store = IndexStore.open(root, "cstfs.db")) {
            IndexBuilder.BuildMetrics m = builder("y\n").build(root, store, s -> {});

            assertEquals(1, m.duplicatesFound.sum());
            assertEquals(1, m.newFilesRemoved.sum());
            assertEquals(List.of("a.jpg", "c.jpg"), indexedPaths(store));
        }
        assertTrue(Files.exists(root.resolve("a.jpg")));
        assertFalse(Files.exists(root.resolve("b.jpg")));

        String out = promptOut.toString(StandardCharsets.UTF_8);
        assertTrue(out.contains("Found path \"b.jpg\", duplicate of \"a.jpg\", would you like to remove it? (Y/n/s/o/?): "), out);
        assertTrue(out.contains("Removed file b.jpg"), out);
    }

    @Test
    void emptyAnswerDefaultsToRemovingTheNewFile() throws Exception {
        Path root = treeWithDuplicate();

        try (IndexStore store = IndexStore.open(root, "cstfs.db")) {
            builder("\n").build(root, store, s -> {});
        }
        assertFalse(Files.exists(root.resolve("b.jpg")));
    }

    @Test
    void answeringOldRemovesTheOriginalAndRebindsTheIndex() throws Exception {
        Path root = treeWithDuplicate();

        try (IndexStore store = IndexStore.open(root, "cstfs.db")) {
            IndexBuilder.BuildMetrics m = builder("o\n").build(root, store, s -> {});

            assertEquals(1, m.oldFilesRemoved.sum());
            assertEquals(List.of("b.jpg", "c.jpg"), indexedPaths(store));
            assertEquals(2L, store.read(ContentIndex::count));
        }
        assertFalse(Files.exists(root.resolve("a.jpg")));
        assertTrue(Files.exists(root.resolve("b.jpg")));

        String out = promptOut.toString(StandardCharsets.UTF_8);
        assertTrue(out.contains("Removed file a.jpg"), out);
        assertTrue(out.contains("Updated index with b.jpg"), out);
    }

    @Test
    void answeringNoAbortsAndCommitsNothing() throws Exception {
        Path root = treeWithDuplicate();

        try (IndexStore store = IndexStore.open(root, "cstfs.db")) {
            assertThrows(RunAbortedException.class, () -> builder("n\n").build(root, store, s -> {}));
            assertEquals(0L, store.read(ContentIndex::count));
        }
        assertTrue(Files.exists(root.resolve("a.jpg")));
        assertTrue(Files.exists(root.resolve("b.jpg")));
        assertTrue(promptOut.toString(StandardCharsets.UTF_8).contains("Quitting..."));
    }

    @Test
    void helpAndInvalidAnswersPromptAgain() throws Exception {
        Path root = treeWithDuplicate();

        try (IndexStore store = IndexStore.open(root, "cstfs.db")) {
            builder("?\nmaybe\nY\n").build(root, store, s -> {});
            assertEquals(List.of("a.jpg", "c.jpg"), indexedPaths(store));
        }

        String out = promptOut.toString(StandardCharsets.UTF_8);
        assertTrue(out.contains("o(Old)  - Remove the old file and keep the new one"), out);
        assertTrue(out.contains("Invalid command, valid ones are (Y/n/s/o/?)"), out);
        assertFalse(Files.exists(root.resolve("b.jpg")));
    }

    @Test
    void skipIsNotImplementedAndRollsBack() throws Exception {
        Path root = treeWithDuplicate();

        try (IndexStore store = IndexStore.open(root, "cstfs.db")) {
            assertThrows(UnsupportedOperationException.class, () -> builder("s\n").build(root, store, s -> {}));
            assertEquals(0L, store.read(ContentIndex::count));
        }
        assertTrue(Files.exists(root.resolve("b.jpg")));
    }

    @Test
    void closedInputFailsTheRun() throws Exception {
        Path root = treeWithDuplicate();

        try (IndexStore store = IndexStore.open(root, "cstfs.db")) {
            assertThrows(java.io.IOException.class, () -> builder("").build(root, store, s -> {}));
            assertEquals(0L, store.read(ContentIndex::count));
        }
    }
}
