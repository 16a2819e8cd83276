package com.clust.sdk.streaming;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Reports the stop reason and the output token count near the end of a stream.
 */
@JsonPropertyOrder({"type", "delta", "usage"})
public class MessageDeltaChunk extends StreamChunk {

    @JsonProperty("delta")
    private final StreamStop delta;

    @JsonProperty("usage")
    private final DeltaUsage usage;

    @JsonCreator
    public MessageDeltaChunk(@JsonProperty(value = "delta", required = true) StreamStop delta,
                             @JsonProperty(value = "usage", required = true) DeltaUsage usage) {
        this.delta = Objects.requireNonNull(delta, "delta must not be null");
        this.usage = Objects.requireNonNull(usage, "usage must not be null");
    }

    @Override
    public StreamChunkType getType() {
        return StreamChunkType.MESSAGE_DELTA;
    }

    public StreamStop getDelta() {
        return delta;
    }

    public DeltaUsage getUsage() {
        return usage;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MessageDeltaChunk that = (MessageDeltaChunk) o;
        return Objects.equals(delta, that.delta) && Objects.equals(usage, that.usage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(delta, usage);
    }
}
