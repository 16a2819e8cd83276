package com.clust.sdk.exceptions;

import com.clust.sdk.models.ApiError;

/**
 * Exception thrown when the API is temporarily overloaded (529).
 */
public class OverloadedException extends ClaudeException {

    public OverloadedException(String message) {
        super(529, message);
    }

    public OverloadedException(ApiError error, String requestId) {
        super(529, error, requestId);
    }
}
