package com.clust.sdk.models;

import com.clust.sdk.json.MessagesJson;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Billing and rate-limit usage of a request.
 *
 * <p>Token counts do not match the visible content one-to-one: the API transforms
 * requests before they reach the model and parses the model output afterwards. For
 * example, {@code output_tokens} is non-zero even for an empty response.</p>
 */
@JsonPropertyOrder({"input_tokens", "output_tokens"})
public class Usage {

    @JsonProperty("input_tokens")
    private final int inputTokens;

    @JsonProperty("output_tokens")
    private final int outputTokens;

    @JsonCreator
    public Usage(@JsonProperty(value = "input_tokens", required = true) int inputTokens,
                 @JsonProperty(value = "output_tokens", required = true) int outputTokens) {
        this.inputTokens = inputTokens;
        this.outputTokens = outputTokens;
    }

    public int getInputTokens() {
        return inputTokens;
    }

    public int getOutputTokens() {
        return outputTokens;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Usage usage = (Usage) o;
        return inputTokens == usage.inputTokens && outputTokens == usage.outputTokens;
    }

    @Override
    public int hashCode() {
        return 31 * inputTokens + outputTokens;
    }

    @Override
    public String toString() {
        return MessagesJson.pretty(this);
    }
}
