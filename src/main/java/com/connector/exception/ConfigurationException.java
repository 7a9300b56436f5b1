package com.connector.exception;

/**
 * A malformed or non-terminating integration definition. Fatal and never retried.
 */
public class ConfigurationException extends ConnectorException {

    public ConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorKind.CONFIGURATION, message, cause);
    }
}
