package com.clust.sdk.streaming;

import com.clust.sdk.json.MessagesJson;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One server-sent event of a Messages API stream, tagged by its {@code type} field.
 */
@JsonTypeInfo(
        use = JsonTypeInfo.Id.NAME,
        include = JsonTypeInfo.As.EXISTING_PROPERTY,
        property = "type"
)
@JsonSubTypes({
    @JsonSubTypes.Type(value = MessageStartChunk.class, name = "message_start"),
    @JsonSubTypes.Type(value = ContentBlockStartChunk.class, name = "content_block_start"),
    @JsonSubTypes.Type(value = PingChunk.class, name = "ping"),
    @JsonSubTypes.Type(value = ContentBlockDeltaChunk.class, name = "content_block_delta"),
    @JsonSubTypes.Type(value = ContentBlockStopChunk.class, name = "content_block_stop"),
    @JsonSubTypes.Type(value = MessageDeltaChunk.class, name = "message_delta"),
    @JsonSubTypes.Type(value = MessageStopChunk.class, name = "message_stop")
})
public abstract class StreamChunk {

    @JsonProperty("type")
    public abstract StreamChunkType getType();

    /**
     * Returns true if this is the last chunk of a stream.
     */
    @JsonIgnore
    public boolean isFinal() {
        return getType() == StreamChunkType.MESSAGE_STOP;
    }

    @Override
    public String toString() {
        return MessagesJson.pretty(this);
    }
}
