package com.filelog.sdk.exception;

/**
 * Bad option value: unknown level name, malformed or negative number, wrong type.
 */
public class InvalidConfigurationException extends FileLogException {

    public static final String ERROR_CODE = "invalid_configuration";

    public InvalidConfigurationException(String message) {
        super(message, ERROR_CODE);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, ERROR_CODE, cause);
    }
}
