package com.clust.sdk.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Whether the response is returned at once or incrementally as server-sent events.
 *
 * <p>Encoded as the boolean {@code stream} field of a request.</p>
 */
public enum StreamOption {
    RETURN_ONCE(false),
    RETURN_STREAM(true);

    private final boolean value;

    StreamOption(boolean value) {
        this.value = value;
    }

    @JsonValue
    public boolean getValue() {
        return value;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static StreamOption fromValue(boolean value) {
        return value ? RETURN_STREAM : RETURN_ONCE;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
