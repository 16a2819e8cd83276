package com.clust.sdk.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The reason the model stopped generating.
 *
 * <ul>
 *   <li>{@code end_turn}: the model reached a natural stopping point</li>
 *   <li>{@code max_tokens}: the requested {@code max_tokens} or the model's maximum was exceeded</li>
 *   <li>{@code stop_sequence}: one of the provided custom stop sequences was generated</li>
 * </ul>
 */
public enum StopReason {
    END_TURN("end_turn"),
    MAX_TOKENS("max_tokens"),
    STOP_SEQUENCE("stop_sequence");

    private final String value;

    StopReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Looks up the constant for a wire value.
     *
     * @throws IllegalArgumentException if the value is not a known stop reason
     */
    public static StopReason fromValue(String value) {
        for (StopReason candidate : values()) {
            if (candidate.value.equals(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown stop reason: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
