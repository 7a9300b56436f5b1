package com.connector.exception;

public class ProviderException extends RequestException {

    public ProviderException(int statusCode, String message) {
        super(ErrorKind.PROVIDER, statusCode, message);
    }

    public ProviderException(String message, Throwable cause) {
        super(ErrorKind.PROVIDER, 0, message, cause);
    }
}
