package com.filelog.sdk.exception;

/**
 * Thrown when closing a log file fails. The handle is released regardless.
 */
public class StreamCloseException extends FileLogException {

    public static final String ERROR_CODE = "stream_close";

    public StreamCloseException(String message) {
        super(message, ERROR_CODE);
    }

    public StreamCloseException(String message, Throwable cause) {
        super(message, ERROR_CODE, cause);
    }
}
