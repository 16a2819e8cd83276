package com.clust.sdk.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Object type of a Messages API response. For messages this is always {@code message}.
 */
public enum MessageObjectType {
    MESSAGE("message");

    private final String value;

    MessageObjectType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Looks up the constant for a wire value.
     *
     * @throws IllegalArgumentException if the value is not a known message object type
     */
    public static MessageObjectType fromValue(String value) {
        for (MessageObjectType candidate : values()) {
            if (candidate.value.equals(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown message object type: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
