package com.clust.sdk.streaming;

import com.clust.sdk.models.content.ContentBlock;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Opens the content block at {@code index}.
 */
@JsonPropertyOrder({"type", "index", "content_block"})
public class ContentBlockStartChunk extends StreamChunk {

    @JsonProperty("index")
    private final int index;

    @JsonProperty("content_block")
    private final ContentBlock contentBlock;

    @JsonCreator
    public ContentBlockStartChunk(@JsonProperty(value = "index", required = true) int index,
                                  @JsonProperty(value = "content_block", required = true) ContentBlock contentBlock) {
        this.index = index;
        this.contentBlock = Objects.requireNonNull(contentBlock, "contentBlock must not be null");
    }

    @Override
    public StreamChunkType getType() {
        return StreamChunkType.CONTENT_BLOCK_START;
    }

    public int getIndex() {
        return index;
    }

    public ContentBlock getContentBlock() {
        return contentBlock;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ContentBlockStartChunk that = (ContentBlockStartChunk) o;
        return index == that.index && Objects.equals(contentBlock, that.contentBlock);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, contentBlock);
    }
}
