package com.cstfs.app.inventory;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Extension allow-list deciding which files belong in the index.
 */
public final class MediaFilter {

    public enum Verdict {
        ACCEPTED,
        NO_EXTENSION,
        NOT_MEDIA
    }

    private final Set<String> extensions;

    public MediaFilter(Set<String> extensions) {
        this.extensions = extensions.stream()
            .map(e -> e.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    }

    public Verdict classify(Path file) {
        Optional<String> ext = extensionOf(file);
        if (ext.isEmpty()) return Verdict.NO_EXTENSION;
        return extensions.contains(ext.get()) ? Verdict.ACCEPTED : Verdict.NOT_MEDIA;
    }

    /**
     * Lower-case text after the last dot. Dot files ({@code .jpg}) and names
     * ending in a dot have no extension.
     */
    static Optional<String> extensionOf(Path file) {
        Path name = file.getFileName();
        if (name == null) return Optional.empty();
        String s = name.toString();
        int idx = s.lastIndexOf('.');
        if (idx <= 0 || idx == s.length() - 1) return Optional.empty();
        return Optional.of(s.substring(idx + 1).toLowerCase(Locale.ROOT));
    }
}
