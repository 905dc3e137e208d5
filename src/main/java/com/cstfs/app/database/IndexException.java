package com.cstfs.app.database;

/**
 * Fatal failure of the content index. Never used for the expected
 * duplicate-hash case, see {@link DuplicateInsertionException}.
 */
public class IndexException extends RuntimeException {

    public enum Reason {
        OPEN,
        MIGRATION,
        QUERY,
        TOO_FEW_ROWS_AFFECTED,
        TOO_MANY_ROWS_AFFECTED,
        HASH_DOES_NOT_EXIST,
        DUPLICATE_PATHS
    }

    private final Reason reason;

    public IndexException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public IndexException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
