package com.cstfs.app.diff;

public enum DiffKind {
    /** Hash not present in the index under this path. */
    NEW,
    /** Same path, different hash. */
    CHANGED,
    /** Indexed path no longer present on disk. */
    REMOVED,
    /** New path whose content is still indexed and live elsewhere. */
    DUPLICATE,
    /** New path whose content was indexed under a path that disappeared. */
    MOVED
}
