package com.connector.exception;

/**
 * Classification of every failure the runtime can surface to the Scenario Engine.
 * <p>
 * The kind decides whether a failure may be retried by the caller: only {@link #RATE_LIMIT}
 * and {@link #PROVIDER} are retryable, everything else is surfaced immediately.
 */
public enum ErrorKind {

    /**
     * Malformed definition, broken expression, non-terminating pagination or a missing required field.
     */
    CONFIGURATION(false, "ConfigurationError"),

    /**
     * Credentials are invalid or can no longer be refreshed; the user has to reconnect.
     */
    AUTH(false, "AuthError"),

    /**
     * The provider throttled the request (HTTP 429).
     */
    RATE_LIMIT(true, "RateLimitError"),

    /**
     * The provider failed (HTTP 5xx or a transport failure).
     */
    PROVIDER(true, "ProviderError"),

    /**
     * The provider rejected the input (other 4xx, or a soft error on a 2xx response).
     */
    VALIDATION(false, "ValidationError"),

    /**
     * An option list could not be resolved in the requested order.
     */
    RPC(false, "RpcError");

    private final boolean retryable;
    private final String label;

    ErrorKind(boolean retryable, String label) {
        this.retryable = retryable;
        this.label = label;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Derives the kind from an HTTP status code: 401/403 are auth failures, 429 is a rate limit,
     * 5xx is a provider failure and every other status is a validation failure.
     */
    public static ErrorKind fromStatus(int statusCode) {
        if (statusCode == 401 || statusCode == 403) {
            return AUTH;
        }
        if (statusCode == 429) {
            return RATE_LIMIT;
        }
        if (statusCode >= 500 || statusCode == 0) {
            return PROVIDER;
        }
        return VALIDATION;
    }

    /**
     * Resolves a kind from its enum name or its label (e.g. {@code "RateLimitError"}), case-insensitively.
     *
     * @return the matching kind, or {@code null} if nothing matches.
     */
    public static ErrorKind fromName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        for (ErrorKind kind : values()) {
            if (kind.name().equalsIgnoreCase(name) || kind.label.equalsIgnoreCase(name)
                    || kind.name().replace("_", "").equalsIgnoreCase(name)) {
                return kind;
            }
        }
        return null;
    }
}
