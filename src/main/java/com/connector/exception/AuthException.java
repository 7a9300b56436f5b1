package com.connector.exception;

/**
 * Credentials were rejected or could not be refreshed. Surfaced as "reconnect required".
 */
public class AuthException extends RequestException {

    public AuthException(int statusCode, String message) {
        super(ErrorKind.AUTH, statusCode, message);
    }

    public AuthException(String message, Throwable cause) {
        super(ErrorKind.AUTH, 0, message, cause);
    }
}
