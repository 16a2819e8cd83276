package com.clust.sdk.models.content;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Media types accepted for image content.
 */
public enum ImageMediaType {
    JPEG("image/jpeg"),
    PNG("image/png"),
    GIF("image/gif"),
    WEBP("image/webp");

    private final String value;

    ImageMediaType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static ImageMediaType fromValue(String value) {
        for (ImageMediaType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown image media type: " + value);
    }

    /**
     * Resolves a media type from a file extension such as {@code png} or {@code .JPG}.
     *
     * @throws IllegalArgumentException if the extension is not a supported image format
     */
    public static ImageMediaType fromExtension(String extension) {
        String normalized = extension.startsWith(".") ? extension.substring(1) : extension;
        switch (normalized.toLowerCase(Locale.ROOT)) {
            case "jpg":
            case "jpeg":
                return JPEG;
            case "png":
                return PNG;
            case "gif":
                return GIF;
            case "webp":
                return WEBP;
            default:
                throw new IllegalArgumentException("Unsupported image extension: " + extension);
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
