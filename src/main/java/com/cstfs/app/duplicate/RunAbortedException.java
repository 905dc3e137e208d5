package com.cstfs.app.duplicate;

/**
 * The operator chose to quit while resolving a duplicate.
 */
public class RunAbortedException extends RuntimeException {

    public RunAbortedException(String message) {
        super(message);
    }
}
