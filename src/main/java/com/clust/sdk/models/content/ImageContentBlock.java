package com.clust.sdk.models.content;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * An image supplied as input.
 */
@JsonPropertyOrder({"type", "source"})
public class ImageContentBlock extends ContentBlock {

    @JsonProperty("source")
    private final ImageContentSource source;

    @JsonCreator
    public ImageContentBlock(@JsonProperty(value = "source", required = true) ImageContentSource source) {
        this.source = Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public ContentType getType() {
        return ContentType.IMAGE;
    }

    public ImageContentSource getSource() {
        return source;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(source, ((ImageContentBlock) o).source);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(source);
    }
}
