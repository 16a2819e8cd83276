package com.clust.sdk.exceptions;

import com.clust.sdk.models.ApiError;
import com.clust.sdk.models.ApiErrorType;

/**
 * Base exception for all Messages API errors.
 */
public class ClaudeException extends RuntimeException {

    private final int statusCode;
    private final ApiErrorType errorType;
    private final String requestId;

    public ClaudeException(String message) {
        super(message);
        this.statusCode = 0;
        this.errorType = null;
        this.requestId = null;
    }

    public ClaudeException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.errorType = null;
        this.requestId = null;
    }

    public ClaudeException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
        this.errorType = null;
        this.requestId = null;
    }

    public ClaudeException(int statusCode, ApiError error, String requestId) {
        super(error.getMessage());
        this.statusCode = statusCode;
        this.errorType = error.getType();
        this.requestId = requestId;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public ApiErrorType getErrorType() {
        return errorType;
    }

    public String getRequestId() {
        return requestId;
    }

    public boolean isUnauthorized() {
        return statusCode == 401;
    }

    public boolean isForbidden() {
        return statusCode == 403;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }

    public boolean isRateLimited() {
        return statusCode == 429;
    }

    public boolean isOverloaded() {
        return statusCode == 529 || errorType == ApiErrorType.OVERLOADED_ERROR;
    }

    public boolean isServerError() {
        return statusCode >= 500;
    }

    public boolean isRetryable() {
        return statusCode == 429 || statusCode >= 500 || isOverloaded();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(getClass().getSimpleName()).append('{');
        if (statusCode > 0) {
            sb.append("statusCode=").append(statusCode).append(", ");
        }
        if (errorType != null) {
            sb.append("errorType=").append(errorType).append(", ");
        }
        sb.append("message='").append(getMessage()).append('\'');
        if (requestId != null) {
            sb.append(", requestId='").append(requestId).append('\'');
        }
        sb.append('}');
        return sb.toString();
    }
}
