package com.clust.sdk.streaming;

import com.clust.sdk.json.MessagesJson;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Cumulative output token count reported by a {@code message_delta} chunk.
 */
public class DeltaUsage {

    @JsonProperty("output_tokens")
    private final int outputTokens;

    @JsonCreator
    public DeltaUsage(@JsonProperty(value = "output_tokens", required = true) int outputTokens) {
        this.outputTokens = outputTokens;
    }

    public int getOutputTokens() {
        return outputTokens;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return outputTokens == ((DeltaUsage) o).outputTokens;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(outputTokens);
    }

    @Override
    public String toString() {
        return MessagesJson.pretty(this);
    }
}
