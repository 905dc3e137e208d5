package com.cstfs.app.database;

/**
 * Raised by {@link ContentIndex#insert} when the hash is already indexed
 * under another path. Recoverable: the caller decides what to keep.
 */
public class DuplicateInsertionException extends Exception {

    private final String existingPath;
    private final String newPath;
    private final String hash;

    public DuplicateInsertionException(String existingPath, String newPath, String hash) {
        super("Path \"" + newPath + "\" duplicates \"" + existingPath + "\" (hash " + hash + ")");
        this.existingPath = existingPath;
        this.newPath = newPath;
        this.hash = hash;
    }

    public String existingPath() {
        return existingPath;
    }

    public String newPath() {
        return newPath;
    }

    public String hash() {
        return hash;
    }
}
