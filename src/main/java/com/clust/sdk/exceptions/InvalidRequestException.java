package com.clust.sdk.exceptions;

import com.clust.sdk.models.ApiError;

/**
 * Exception thrown when the request is malformed or missing data (400 Bad Request).
 */
public class InvalidRequestException extends ClaudeException {

    public InvalidRequestException(String message) {
        super(400, message);
    }

    public InvalidRequestException(ApiError error, String requestId) {
        super(400, error, requestId);
    }
}
