package com.cstfs.app.database;

/**
 * One persisted row of the {@code files} table. The hash is the identity.
 */
public record IndexEntry(String path, String hash) {}
