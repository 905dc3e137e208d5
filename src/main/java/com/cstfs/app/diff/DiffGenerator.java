package com.cstfs.app.diff;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cstfs.app.database.IndexEntry;
import com.cstfs.app.inventory.ContentHasher;
import com.cstfs.app.inventory.DirectoryEntry;
import com.cstfs.app.inventory.DirectoryScanner;

/**
 * Produces the elementary diff between the live tree and the persisted index.
 * <p>
 * Records come out in two passes: live files first (NEW, CHANGED) in scan
 * order, then index entries whose path vanished (REMOVED) in index order.
 * A path never yields more than one record.
 */
public final class DiffGenerator {

    private static final Logger logger = LoggerFactory.getLogger(DiffGenerator.class);

    private final DirectoryScanner scanner;
    private final ContentHasher hasher;

    public DiffGenerator(DirectoryScanner scanner, ContentHasher hasher) {
        this.scanner = scanner;
        this.hasher = hasher;
    }

    public List<DiffRecord> generate(Path root, List<IndexEntry> snapshot) throws IOException {
        return compare(liveSnapshot(root, s -> {}), snapshot);
    }

    /**
     * Scans and hashes the tree. {@code progress} receives one line per file.
     */
    public List<DirectoryEntry> liveSnapshot(Path root, Consumer<String> progress) throws IOException {
        List<Path> files = scanner.scan(root);
        List<DirectoryEntry> out = new ArrayList<>(files.size());
        int total = files.size();
        int i = 0;
        for (Path file : files) {
            i++;
            progress.accept("Hashing file " + i + "/" + total + "...");
            out.add(new DirectoryEntry(DirectoryScanner.relativize(root, file), hasher.hash(file)));
        }
        return out;
    }

    public static List<DiffRecord> compare(List<DirectoryEntry> live, List<IndexEntry> snapshot) {
        Map<String, IndexEntry> byPath = new LinkedHashMap<>();
        for (IndexEntry entry : snapshot) {
            IndexEntry previous = byPath.putIfAbsent(entry.path(), entry);
            if (previous != null) {
                logger.warn("Index lists path {} twice (hashes {} and {}); using the first",
                    entry.path(), previous.hash(), entry.hash());
            }
        }

        List<DiffRecord> diffs = new ArrayList<>();
        Set<String> livePaths = new HashSet<>();

        for (DirectoryEntry file : live) {
            livePaths.add(file.path());
            IndexEntry indexed = byPath.get(file.path());
            if (indexed == null) {
                diffs.add(DiffRecord.added(file.path(), file.hash()));
            } else if (!indexed.hash().equals(file.hash())) {
                diffs.add(DiffRecord.changed(file.path(), file.hash(), indexed.hash()));
            }
        }

        for (IndexEntry indexed : byPath.values()) {
            if (!livePaths.contains(indexed.path())) {
                diffs.add(DiffRecord.removed(indexed.path(), indexed.hash()));
            }
        }
        return diffs;
    }
}
