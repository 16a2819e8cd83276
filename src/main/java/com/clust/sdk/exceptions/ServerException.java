package com.clust.sdk.exceptions;

import com.clust.sdk.models.ApiError;

/**
 * Exception thrown for unexpected errors on the API side (5xx).
 */
public class ServerException extends ClaudeException {

    public ServerException(int statusCode, String message) {
        super(statusCode, message);
    }

    public ServerException(int statusCode, ApiError error, String requestId) {
        super(statusCode, error, requestId);
    }
}
