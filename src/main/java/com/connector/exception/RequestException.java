package com.connector.exception;

/**
 * A failed Call: the provider answered with an error status, a soft error, or could not be reached.
 * <p>
 * The message is the resolved, user-visible error text; {@link #toEnvelope()} renders the standard
 * {@code [<statusCode>] <message>} envelope.
 */
public class RequestException extends ConnectorException {

    private final int statusCode;

    public RequestException(ErrorKind kind, int statusCode, String message) {
        super(kind, message);
        this.statusCode = statusCode;
    }

    public RequestException(ErrorKind kind, int statusCode, String message, Throwable cause) {
        super(kind, message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String toEnvelope() {
        String prefix = "[" + statusCode + "]";
        String message = getMessage();
        if (message == null || message.isBlank()) {
            return prefix;
        }
        return message.startsWith(prefix) ? message : prefix + " " + message;
    }

    /**
     * Creates the subclass matching the given kind.
     *
     * @param kind              The classification of the failure.
     * @param statusCode        The HTTP status code, {@code 0} for transport failures.
     * @param message           The resolved error message.
     * @param retryAfterSeconds The provider's retry-after hint, only used for rate limits; may be {@code null}.
     * @return A typed request exception.
     */
    public static RequestException of(ErrorKind kind, int statusCode, String message, Long retryAfterSeconds) {
        return switch (kind) {
            case AUTH -> new AuthException(statusCode, message);
            case RATE_LIMIT -> new RateLimitException(statusCode, message, retryAfterSeconds);
            case PROVIDER -> new ProviderException(statusCode, message);
            case VALIDATION -> new ValidationException(statusCode, message);
            default -> new RequestException(kind, statusCode, message);
        };
    }
}
