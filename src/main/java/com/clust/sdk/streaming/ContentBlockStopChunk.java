package com.clust.sdk.streaming;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Closes the content block at {@code index}.
 */
@JsonPropertyOrder({"type", "index"})
public class ContentBlockStopChunk extends StreamChunk {

    @JsonProperty("index")
    private final int index;

    @JsonCreator
    public ContentBlockStopChunk(@JsonProperty(value = "index", required = true) int index) {
        this.index = index;
    }

    @Override
    public StreamChunkType getType() {
        return StreamChunkType.CONTENT_BLOCK_STOP;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return index == ((ContentBlockStopChunk) o).index;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(index);
    }
}
