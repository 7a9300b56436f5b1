package com.connector.exception;

import java.time.Duration;

/**
 * The provider throttled the request. Carries the provider's retry-after hint when one was sent.
 */
public class RateLimitException extends RequestException {

    private final Long retryAfterSeconds;

    public RateLimitException(int statusCode, String message, Long retryAfterSeconds) {
        super(ErrorKind.RATE_LIMIT, statusCode, message);
        this.retryAfterSeconds = retryAfterSeconds;
    }

    /**
     * @return the hinted wait, or {@code null} when the provider sent no usable {@code Retry-After} header.
     */
    public Duration getRetryAfter() {
        return retryAfterSeconds == null ? null : Duration.ofSeconds(retryAfterSeconds);
    }
}
