package com.clust.sdk.streaming;

import com.clust.sdk.json.MessagesJson;
import com.clust.sdk.models.StopReason;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Top-level message changes reported by a {@code message_delta} chunk.
 */
@JsonPropertyOrder({"stop_reason", "stop_sequence"})
public class StreamStop {

    @JsonProperty("stop_reason")
    private final StopReason stopReason;

    @JsonProperty("stop_sequence")
    private final String stopSequence;

    @JsonCreator
    public StreamStop(@JsonProperty("stop_reason") StopReason stopReason,
                      @JsonProperty("stop_sequence") String stopSequence) {
        this.stopReason = stopReason;
        this.stopSequence = stopSequence;
    }

    public StopReason getStopReason() {
        return stopReason;
    }

    public String getStopSequence() {
        return stopSequence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StreamStop that = (StreamStop) o;
        return stopReason == that.stopReason && Objects.equals(stopSequence, that.stopSequence);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stopReason, stopSequence);
    }

    @Override
    public String toString() {
        return MessagesJson.pretty(this);
    }
}
