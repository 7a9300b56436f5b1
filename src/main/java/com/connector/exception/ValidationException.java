package com.connector.exception;

/**
 * The provider (or the runtime's own parameter check) rejected the input. Surfaced verbatim, never retried.
 */
public class ValidationException extends RequestException {

    public ValidationException(int statusCode, String message) {
        super(ErrorKind.VALIDATION, statusCode, message);
    }
}
