package com.filelog.sdk.exception;

/**
 * Operation not allowed in the logger's current state.
 */
public class InvalidStateException extends FileLogException {

    public static final String ERROR_CODE = "invalid_state";

    public InvalidStateException(String message) {
        super(message, ERROR_CODE);
    }

    public InvalidStateException(String message, Throwable cause) {
        super(message, ERROR_CODE, cause);
    }
}
