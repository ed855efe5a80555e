package com.filelog.sdk.exception;

/**
 * Thrown when a log file cannot be opened for appending.
 */
public class StreamOpenException extends FileLogException {

    public static final String ERROR_CODE = "stream_open";

    public StreamOpenException(String message) {
        super(message, ERROR_CODE);
    }

    public StreamOpenException(String message, Throwable cause) {
        super(message, ERROR_CODE, cause);
    }
}
