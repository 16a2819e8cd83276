package com.clust.sdk.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Models available through the Messages API.
 */
public enum ClaudeModel {
    CLAUDE_3_OPUS_20240229("claude-3-opus-20240229", 4096),
    CLAUDE_3_SONNET_20240229("claude-3-sonnet-20240229", 4096),
    CLAUDE_3_HAIKU_20240307("claude-3-haiku-20240307", 4096),
    CLAUDE_3_5_SONNET_20240620("claude-3-5-sonnet-20240620", 4096),
    CLAUDE_2_1("claude-2.1", 4096),
    CLAUDE_2_0("claude-2.0", 4096),
    CLAUDE_INSTANT_1_2("claude-instant-1.2", 4096);

    private final String value;
    private final int maxTokens;

    ClaudeModel(String value, int maxTokens) {
        this.value = value;
        this.maxTokens = maxTokens;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Returns the most tokens this model can generate in one request.
     */
    public int getMaxTokens() {
        return maxTokens;
    }

    public static ClaudeModel fromValue(String value) {
        for (ClaudeModel model : values()) {
            if (model.value.equals(value)) {
                return model;
            }
        }
        throw new IllegalArgumentException("Unknown model: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
