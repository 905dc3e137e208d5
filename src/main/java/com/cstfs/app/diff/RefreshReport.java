package com.cstfs.app.diff;

import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Outcome of one reconciliation pass: the coalesced records plus timing.
 */
public record RefreshReport(Path root, List<DiffRecord> records, Duration elapsed) {

    public RefreshReport {
        records = List.copyOf(records);
    }

    public long count(DiffKind kind) {
        return records.stream().filter(r -> r.kind() == kind).count();
    }

    public Map<DiffKind, Long> counts() {
        Map<DiffKind, Long> out = new EnumMap<>(DiffKind.class);
        for (DiffKind kind : DiffKind.values()) out.put(kind, 0L);
        out.putAll(records.stream().collect(Collectors.groupingBy(DiffRecord::kind, Collectors.counting())));
        return out;
    }

    public boolean isClean() {
        return records.isEmpty();
    }

    public String summary() {
        return counts().entrySet().stream()
            .map(e -> e.getKey().name().toLowerCase(Locale.ROOT) + "=" + e.getValue())
            .collect(Collectors.joining(", "));
    }
}
