package com.clust.sdk.streaming;

import com.clust.sdk.models.MessagesResponseBody;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * First chunk of a stream, carrying the message with empty content.
 */
@JsonPropertyOrder({"type", "message"})
public class MessageStartChunk extends StreamChunk {

    @JsonProperty("message")
    private final MessagesResponseBody message;

    @JsonCreator
    public MessageStartChunk(@JsonProperty(value = "message", required = true) MessagesResponseBody message) {
        this.message = Objects.requireNonNull(message, "message must not be null");
    }

    @Override
    public StreamChunkType getType() {
        return StreamChunkType.MESSAGE_START;
    }

    public MessagesResponseBody getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(message, ((MessageStartChunk) o).message);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(message);
    }
}
