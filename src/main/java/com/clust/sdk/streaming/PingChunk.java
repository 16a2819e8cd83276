package com.clust.sdk.streaming;

/**
 * Keep-alive event.
 */
public class PingChunk extends StreamChunk {

    @Override
    public StreamChunkType getType() {
        return StreamChunkType.PING;
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
