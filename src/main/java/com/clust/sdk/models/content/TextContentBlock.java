package com.clust.sdk.models.content;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A block of text.
 */
@JsonPropertyOrder({"type", "text"})
public class TextContentBlock extends ContentBlock {

    @JsonProperty("text")
    private final String text;

    @JsonCreator
    public TextContentBlock(@JsonProperty(value = "text", required = true) String text) {
        this.text = Objects.requireNonNull(text, "text must not be null");
    }

    @Override
    public ContentType getType() {
        return ContentType.TEXT;
    }

    public String getText() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(text, ((TextContentBlock) o).text);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(text);
    }
}
