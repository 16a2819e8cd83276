package com.clust.sdk.exceptions;

import com.clust.sdk.models.ApiError;

/**
 * Exception thrown when the API key lacks access to the resource (403 Forbidden).
 */
public class PermissionException extends ClaudeException {

    public PermissionException(String message) {
        super(403, message);
    }

    public PermissionException(ApiError error, String requestId) {
        super(403, error, requestId);
    }
}
