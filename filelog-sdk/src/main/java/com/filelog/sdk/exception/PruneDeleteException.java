package com.filelog.sdk.exception;

/**
 * Raised when an archived log file cannot be deleted during pruning.
 */
public class PruneDeleteException extends FileLogException {

    public static final String ERROR_CODE = "prune_delete";

    public PruneDeleteException(String message) {
        super(message, ERROR_CODE);
    }

    public PruneDeleteException(String message, Throwable cause) {
        super(message, ERROR_CODE, cause);
    }
}
