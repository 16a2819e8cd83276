package com.clust.sdk.exceptions;

import com.clust.sdk.models.ApiError;

/**
 * Exception thrown when the requested resource does not exist (404 Not Found).
 */
public class NotFoundException extends ClaudeException {

    public NotFoundException(String message) {
        super(404, message);
    }

    public NotFoundException(ApiError error, String requestId) {
        super(404, error, requestId);
    }
}
