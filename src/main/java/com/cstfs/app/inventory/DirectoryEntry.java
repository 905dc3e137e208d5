package com.cstfs.app.inventory;

/**
 * A live file seen during one reconciliation pass: root-relative path
 * (forward slashes) and content hash. Never persisted.
 */
public record DirectoryEntry(String path, String hash) {}
