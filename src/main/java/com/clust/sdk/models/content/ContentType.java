package com.clust.sdk.models.content;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Discriminator of a {@link ContentBlock}.
 */
public enum ContentType {
    TEXT("text"),
    IMAGE("image"),
    TEXT_DELTA("text_delta");

    private final String value;

    ContentType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static ContentType fromValue(String value) {
        for (ContentType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown content type: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
