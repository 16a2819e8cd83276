package com.clust.sdk.models;

import com.clust.sdk.json.MessagesJson;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * The {@code error} object of an API error reply.
 */
@JsonPropertyOrder({"type", "message"})
public class ApiError {

    @JsonProperty("type")
    private ApiErrorType type;

    @JsonProperty("message")
    private String message;

    // Default constructor for Jackson
    public ApiError() {}

    public ApiError(ApiErrorType type, String message) {
        this.type = type;
        this.message = message;
    }

    public ApiErrorType getType() {
        return type;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ApiError that = (ApiError) o;
        return type == that.type && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, message);
    }

    @Override
    public String toString() {
        return MessagesJson.pretty(this);
    }
}
