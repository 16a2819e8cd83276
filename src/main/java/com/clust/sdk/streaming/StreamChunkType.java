package com.clust.sdk.streaming;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Types of server-sent events in a Messages API stream.
 *
 * <p>A stream runs {@code message_start}, then for each content block {@code content_block_start},
 * one or more {@code content_block_delta} and {@code content_block_stop}, then one or more
 * {@code message_delta} and a final {@code message_stop}. {@code ping} may appear anywhere.</p>
 */
public enum StreamChunkType {
    MESSAGE_START("message_start"),
    CONTENT_BLOCK_START("content_block_start"),
    PING("ping"),
    CONTENT_BLOCK_DELTA("content_block_delta"),
    CONTENT_BLOCK_STOP("content_block_stop"),
    MESSAGE_DELTA("message_delta"),
    MESSAGE_STOP("message_stop");

    private final String value;

    StreamChunkType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static StreamChunkType fromValue(String value) {
        for (StreamChunkType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown stream chunk type: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
