package com.clust.sdk.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Conversational role of a message.
 */
public enum Role {
    USER("user"),
    ASSISTANT("assistant");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Looks up the constant for a wire value.
     *
     * @throws IllegalArgumentException if the value is not a known role
     */
    public static Role fromValue(String value) {
        for (Role candidate : values()) {
            if (candidate.value.equals(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown role: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
