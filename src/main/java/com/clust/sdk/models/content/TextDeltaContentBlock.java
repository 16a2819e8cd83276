package com.clust.sdk.models.content;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Incremental text of a streamed content block.
 */
@JsonPropertyOrder({"type", "text"})
public class TextDeltaContentBlock extends ContentBlock {

    @JsonProperty("text")
    private final String text;

    @JsonCreator
    public TextDeltaContentBlock(@JsonProperty(value = "text", required = true) String text) {
        this.text = Objects.requireNonNull(text, "text must not be null");
    }

    @Override
    public ContentType getType() {
        return ContentType.TEXT_DELTA;
    }

    public String getText() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(text, ((TextDeltaContentBlock) o).text);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(text);
    }
}
