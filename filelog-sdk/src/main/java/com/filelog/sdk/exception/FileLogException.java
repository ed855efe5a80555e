package com.filelog.sdk.exception;

/**
 * Base exception for FileLog SDK errors
 */
public class FileLogException extends RuntimeException {

    private final String errorCode;

    public FileLogException(String message) {
        super(message);
        this.errorCode = null;
    }

    public FileLogException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = null;
    }

    public FileLogException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public FileLogException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Short machine-readable identifier, e.g. {@code stream_open}. May be null.
     */
    public String getErrorCode() {
        return errorCode;
    }
}
