package com.connector.exception;

/**
 * Root of the runtime's exception hierarchy.
 * <p>
 * Every failure raised while executing a module, RPC, webhook or connection flow is a subclass of this
 * unchecked exception and carries an {@link ErrorKind}, which tells the Scenario Engine whether the
 * failure may be retried and how it should be presented to the user.
 */
public class ConnectorException extends RuntimeException {

    private final ErrorKind kind;

    /**
     * Constructs a new ConnectorException with the specified kind and detail message.
     *
     * @param kind    The classification of the failure.
     * @param message The detail message.
     */
    public ConnectorException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Constructs a new ConnectorException with the specified kind, detail message and cause.
     *
     * @param kind    The classification of the failure.
     * @param message The detail message.
     * @param cause   The underlying cause, may be {@code null}.
     */
    public ConnectorException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
