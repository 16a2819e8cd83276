package com.clust.sdk.models;

import com.clust.sdk.json.MessagesJson;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Body of an API error reply, also sent as an {@code error} event inside a stream.
 *
 * <pre>{@code
 * {"type": "error", "error": {"type": "not_found_error", "message": "..."}}
 * }</pre>
 */
@JsonPropertyOrder({"type", "error"})
public class ErrorResponseBody {

    public static final String TYPE = "error";

    @JsonProperty("error")
    private final ApiError error;

    @JsonCreator
    public ErrorResponseBody(@JsonProperty(value = "error", required = true) ApiError error) {
        this.error = Objects.requireNonNull(error, "error must not be null");
    }

    @JsonProperty("type")
    public String getType() {
        return TYPE;
    }

    public ApiError getError() {
        return error;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(error, ((ErrorResponseBody) o).error);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(error);
    }

    @Override
    public String toString() {
        return MessagesJson.pretty(this);
    }
}
