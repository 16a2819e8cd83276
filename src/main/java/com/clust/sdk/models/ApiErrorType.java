package com.clust.sdk.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Error types reported in the {@code error} object of an API error reply.
 */
public enum ApiErrorType {
    INVALID_REQUEST_ERROR("invalid_request_error", 400),
    AUTHENTICATION_ERROR("authentication_error", 401),
    PERMISSION_ERROR("permission_error", 403),
    NOT_FOUND_ERROR("not_found_error", 404),
    RATE_LIMIT_ERROR("rate_limit_error", 429),
    API_ERROR("api_error", 500),
    OVERLOADED_ERROR("overloaded_error", 529);

    private final String value;
    private final int statusCode;

    ApiErrorType(String value, int statusCode) {
        this.value = value;
        this.statusCode = statusCode;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Returns the HTTP status the API pairs with this error type.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public static ApiErrorType fromValue(String value) {
        for (ApiErrorType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown API error type: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
