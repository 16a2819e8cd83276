package com.clust.sdk.models.content;

import com.clust.sdk.json.MessagesJson;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One unit of content, tagged by its {@code type} field.
 *
 * <p>Decoding fails for an unknown or missing {@code type}.</p>
 */
@JsonTypeInfo(
        use = JsonTypeInfo.Id.NAME,
        include = JsonTypeInfo.As.EXISTING_PROPERTY,
        property = "type"
)
@JsonSubTypes({
    @JsonSubTypes.Type(value = TextContentBlock.class, name = "text"),
    @JsonSubTypes.Type(value = ImageContentBlock.class, name = "image"),
    @JsonSubTypes.Type(value = TextDeltaContentBlock.class, name = "text_delta")
})
public abstract class ContentBlock {

    @JsonProperty("type")
    public abstract ContentType getType();

    @Override
    public String toString() {
        return MessagesJson.pretty(this);
    }
}
