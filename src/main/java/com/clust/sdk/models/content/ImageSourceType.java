package com.clust.sdk.models.content;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Encoding of image data. Only base64 is supported.
 */
public enum ImageSourceType {
    BASE64("base64");

    private final String value;

    ImageSourceType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static ImageSourceType fromValue(String value) {
        for (ImageSourceType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown image source type: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
