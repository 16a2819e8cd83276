package com.clust.sdk.streaming;

/**
 * Last chunk of a stream.
 */
public class MessageStopChunk extends StreamChunk {

    @Override
    public StreamChunkType getType() {
        return StreamChunkType.MESSAGE_STOP;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o != null && getClass() == o.getClass());
    }

    @Override
    public int hashCode() {
        return getType().hashCode();
    }
}
