package com.filelog.sdk.exception;

/**
 * Thrown when the active log file cannot be renamed to its archive name.
 */
public class RotationRenameException extends FileLogException {

    public static final String ERROR_CODE = "rotation_rename";

    public RotationRenameException(String message) {
        super(message, ERROR_CODE);
    }

    public RotationRenameException(String message, Throwable cause) {
        super(message, ERROR_CODE, cause);
    }
}
