package com.clust.sdk.streaming;

import com.clust.sdk.models.content.TextDeltaContentBlock;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Appends text to the content block at {@code index}.
 */
@JsonPropertyOrder({"type", "index", "delta"})
public class ContentBlockDeltaChunk extends StreamChunk {

    @JsonProperty("index")
    private final int index;

    @JsonProperty("delta")
    private final TextDeltaContentBlock delta;

    @JsonCreator
    public ContentBlockDeltaChunk(@JsonProperty(value = "index", required = true) int index,
                                  @JsonProperty(value = "delta", required = true) TextDeltaContentBlock delta) {
        this.index = index;
        this.delta = Objects.requireNonNull(delta, "delta must not be null");
    }

    @Override
    public StreamChunkType getType() {
        return StreamChunkType.CONTENT_BLOCK_DELTA;
    }

    public int getIndex() {
        return index;
    }

    public TextDeltaContentBlock getDelta() {
        return delta;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ContentBlockDeltaChunk that = (ContentBlockDeltaChunk) o;
        return index == that.index && Objects.equals(delta, that.delta);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, delta);
    }
}
