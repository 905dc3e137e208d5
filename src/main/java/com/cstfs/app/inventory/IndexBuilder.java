package com.cstfs.app.inventory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cstfs.app.database.ContentIndex;
import com.cstfs.app.database.DuplicateInsertionException;
import com.cstfs.app.database.IndexStore;
import com.cstfs.app.duplicate.Command;
import com.cstfs.app.duplicate.DuplicatePrompt;

/**
 * Full index build: walk, hash and insert every eligible file in a single
 * transaction. Nothing is committed unless every file went through, so an
 * abort or failure leaves the previous index untouched.
 */
public final class IndexBuilder {

    public static final class BuildMetrics {
        public final LongAdder filesSeen = new LongAdder();
        public final LongAdder filesInserted = new LongAdder();
        public final LongAdder duplicatesFound = new LongAdder();
        public final LongAdder newFilesRemoved = new LongAdder();
        public final LongAdder oldFilesRemoved = new LongAdder();
        public volatile Duration elapsed = Duration.ZERO;
    }

    private static final Logger logger = LoggerFactory.getLogger(IndexBuilder.class);

    private final DirectoryScanner scanner;
    private final ContentHasher hasher;
    private final DuplicatePrompt prompt;

    public IndexBuilder(DirectoryScanner scanner, ContentHasher hasher, DuplicatePrompt prompt) {
        this.scanner = scanner;
        this.hasher = hasher;
        this.prompt = prompt;
    }

    public BuildMetrics build(Path root, IndexStore store, Consumer<String> console) throws IOException {
        return build(root, store, console, false);
    }

    /**
     * @param replaceExisting drop the current entries first, in the same
     *        transaction, so an aborted rebuild keeps the previous index
     */
    public BuildMetrics build(Path root, IndexStore store, Consumer<String> console, boolean replaceExisting) throws IOException {
        Path rootAbs = root.toAbsolutePath().normalize();
        BuildMetrics metrics = new BuildMetrics();

        console.accept("Starting database generation at \"" + rootAbs + "\"");
        Instant start = Instant.now();

        List<Path> files = scanner.scan(rootAbs);
        int total = files.size();

        store.inTransaction(index -> {
            if (replaceExisting) {
                int dropped = index.clear();
                logger.debug("Cleared {} entries before rebuilding", dropped);
            }
            int i = 0;
            for (Path file : files) {
                i++;
                console.accept("Adding file " + i + "/" + total + "...");
                metrics.filesSeen.increment();

                String hash = hasher.hash(file);
                String rel = DirectoryScanner.relativize(rootAbs, file);
                insert(rootAbs, index, rel, hash, metrics);
            }
            return null;
        });

        metrics.elapsed = Duration.between(start, Instant.now());
        console.accept("Done generating database at \"" + rootAbs + "\". Took " + metrics.elapsed.toMillis() + "ms");
        logger.info("Index built: {} files seen, {} inserted, {} duplicates",
            metrics.filesSeen.sum(), metrics.filesInserted.sum(), metrics.duplicatesFound.sum());
        return metrics;
    }

    private void insert(Path root, ContentIndex index, String path, String hash, BuildMetrics metrics) throws IOException {
        try {
            index.insert(path, hash);
            metrics.filesInserted.increment();
        } catch (DuplicateInsertionException e) {
            metrics.duplicatesFound.increment();
            logger.debug("Duplicate content: {}", e.getMessage());
            Command applied = prompt.resolve(root, e, index);
            if (applied == Command.REMOVE_NEW) {
                metrics.newFilesRemoved.increment();
            } else if (applied == Command.REMOVE_OLD) {
                metrics.oldFilesRemoved.increment();
            }
        }
    }
}
