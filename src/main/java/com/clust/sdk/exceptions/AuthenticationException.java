package com.clust.sdk.exceptions;

import com.clust.sdk.models.ApiError;

/**
 * Exception thrown when the API key is missing or invalid (401 Unauthorized).
 */
public class AuthenticationException extends ClaudeException {

    public AuthenticationException(String message) {
        super(401, message);
    }

    public AuthenticationException(ApiError error, String requestId) {
        super(401, error, requestId);
    }
}
