package com.clust.sdk.models.content;

import com.clust.sdk.json.MessagesJson;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Base64;
import java.util.Objects;

/**
 * Source of an image: its encoding, media type and encoded data.
 */
@JsonPropertyOrder({"type", "media_type", "data"})
public class ImageContentSource {

    @JsonProperty("type")
    private final ImageSourceType type;

    @JsonProperty("media_type")
    private final ImageMediaType mediaType;

    @JsonProperty("data")
    private final String data;

    public ImageContentSource(ImageMediaType mediaType, String base64Data) {
        this(ImageSourceType.BASE64, mediaType, base64Data);
    }

    @JsonCreator
    private ImageContentSource(@JsonProperty(value = "type", required = true) ImageSourceType type,
                               @JsonProperty(value = "media_type", required = true) ImageMediaType mediaType,
                               @JsonProperty(value = "data", required = true) String base64Data) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.mediaType = Objects.requireNonNull(mediaType, "mediaType must not be null");
        this.data = Objects.requireNonNull(base64Data, "data must not be null");
    }

    /**
     * Creates a base64 source from raw image bytes.
     */
    public static ImageContentSource base64(ImageMediaType mediaType, byte[] image) {
        return new ImageContentSource(mediaType, Base64.getEncoder().encodeToString(image));
    }

    public ImageSourceType getType() {
        return type;
    }

    public ImageMediaType getMediaType() {
        return mediaType;
    }

    public String getData() {
        return data;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ImageContentSource that = (ImageContentSource) o;
        return type == that.type && mediaType == that.mediaType && Objects.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, mediaType, data);
    }

    @Override
    public String toString() {
        return MessagesJson.pretty(this);
    }
}
