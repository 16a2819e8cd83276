package com.clust.sdk.exceptions;

import com.fasterxml.jackson.core.JsonProcessingException;

/**
 * Exception thrown when JSON does not match the shape of the expected model type.
 */
public class DecodingException extends ClaudeException {

    private final Class<?> targetType;

    public DecodingException(Class<?> targetType, JsonProcessingException cause) {
        super("Failed to decode " + targetType.getSimpleName() + ": " + cause.getOriginalMessage(), cause);
        this.targetType = targetType;
    }

    public DecodingException(Class<?> targetType, String message) {
        super("Failed to decode " + targetType.getSimpleName() + ": " + message);
        this.targetType = targetType;
    }

    /**
     * Returns the type the JSON was being decoded into.
     */
    public Class<?> getTargetType() {
        return targetType;
    }
}
