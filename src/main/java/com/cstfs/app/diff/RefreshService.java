package com.cstfs.app.diff;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cstfs.app.database.ContentIndex;
import com.cstfs.app.database.IndexEntry;
import com.cstfs.app.database.IndexStore;
import com.cstfs.app.inventory.DirectoryEntry;

/**
 * Reports what changed since the last committed index. Read-only: the
 * index is never modified by a refresh.
 */
public final class RefreshService {

    private static final Logger logger = LoggerFactory.getLogger(RefreshService.class);

    private final DiffGenerator generator;

    public RefreshService(DiffGenerator generator) {
        this.generator = generator;
    }

    public RefreshReport refresh(Path root, IndexStore store, Consumer<String> console) throws IOException {
        Path rootAbs = root.toAbsolutePath().normalize();
        console.accept("Starting refresh of \"" + rootAbs + "\"");
        Instant start = Instant.now();

        List<IndexEntry> snapshot = store.read(ContentIndex::scanAll);
        List<DirectoryEntry> live = generator.liveSnapshot(rootAbs, logger::trace);

        List<DiffRecord> diffs = DiffGenerator.compare(live, snapshot);
        logger.debug("Elementary diff: {} records over {} live files and {} indexed", diffs.size(), live.size(), snapshot.size());
        DiffCoalescer.coalesce(diffs, snapshot);

        RefreshReport report = new RefreshReport(rootAbs, diffs, Duration.between(start, Instant.now()));
        console.accept("Done refreshing \"" + rootAbs + "\". Took " + report.elapsed().toMillis() + "ms");
        return report;
    }
}
