package com.cstfs.app.diff;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One change between the live tree and the index.
 * <p>
 * {@code previousHash} is set for {@link DiffKind#CHANGED} only;
 * {@code originalPath} for {@link DiffKind#DUPLICATE} and {@link DiffKind#MOVED} only.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiffRecord(String path, String hash, DiffKind kind, String previousHash, String originalPath) {

    public static DiffRecord added(String path, String hash) {
        return new DiffRecord(path, hash, DiffKind.NEW, null, null);
    }

    public static DiffRecord changed(String path, String hash, String previousHash) {
        return new DiffRecord(path, hash, DiffKind.CHANGED, previousHash, null);
    }

    public static DiffRecord removed(String path, String hash) {
        return new DiffRecord(path, hash, DiffKind.REMOVED, null, null);
    }

    public static DiffRecord duplicate(String path, String hash, String originalPath) {
        return new DiffRecord(path, hash, DiffKind.DUPLICATE, null, originalPath);
    }

    public static DiffRecord moved(String path, String hash, String originalPath) {
        return new DiffRecord(path, hash, DiffKind.MOVED, null, originalPath);
    }

    public String describe() {
        return switch (kind) {
            case NEW -> "New       " + path;
            case CHANGED -> "Changed   " + path + " (" + previousHash + " -> " + hash + ")";
            case REMOVED -> "Removed   " + path;
            case DUPLICATE -> "Duplicate " + path + " of " + originalPath;
            case MOVED -> "Moved     " + originalPath + " -> " + path;
        };
    }
}
