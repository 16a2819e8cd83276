package com.clust.sdk.exceptions;

import com.clust.sdk.models.ApiError;

/**
 * Exception thrown when rate limited (429 Too Many Requests).
 */
public class RateLimitException extends ClaudeException {

    private final Long retryAfter;

    public RateLimitException(String message) {
        super(429, message);
        this.retryAfter = null;
    }

    public RateLimitException(ApiError error, String requestId) {
        this(error, requestId, null);
    }

    public RateLimitException(ApiError error, String requestId, Long retryAfter) {
        super(429, error, requestId);
        this.retryAfter = retryAfter;
    }

    /**
     * Returns the number of seconds to wait before retrying, or null if the reply did not say.
     */
    public Long getRetryAfter() {
        return retryAfter;
    }
}
