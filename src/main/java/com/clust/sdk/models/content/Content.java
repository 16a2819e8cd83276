package com.clust.sdk.models.content;

import com.clust.sdk.json.MessagesJson;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Content of a message: either a single text string or an ordered list of content blocks.
 *
 * <p>A single text is encoded as a JSON string, a list of blocks as a JSON array:</p>
 * <pre>{@code
 * "content": "Hello, Claude"
 * "content": [{"type": "text", "text": "Hello, Claude"}]
 * }</pre>
 */
@JsonDeserialize(using = Content.Deserializer.class)
public final class Content {

    private final String text;
    private final List<ContentBlock> blocks;

    private Content(String text, List<ContentBlock> blocks) {
        this.text = text;
        this.blocks = blocks;
    }

    public static Content text(String text) {
        return new Content(Objects.requireNonNull(text, "text must not be null"), null);
    }

    public static Content blocks(List<? extends ContentBlock> blocks) {
        Objects.requireNonNull(blocks, "blocks must not be null");
        List<ContentBlock> copy = new ArrayList<>(blocks.size());
        for (ContentBlock block : blocks) {
            copy.add(Objects.requireNonNull(block, "blocks must not contain null"));
        }
        return new Content(null, Collections.unmodifiableList(copy));
    }

    public static Content of(ContentBlock... blocks) {
        return blocks(Arrays.asList(blocks));
    }

    /**
     * Returns true if this content is a single text string rather than a list of blocks.
     */
    public boolean isText() {
        return text != null;
    }

    /**
     * Returns the single text, or null if this content is a list of blocks.
     */
    public String getText() {
        return text;
    }

    /**
     * Returns the blocks of this content. A single text is returned as one text block.
     */
    public List<ContentBlock> getBlocks() {
        if (isText()) {
            return List.of(new TextContentBlock(text));
        }
        return blocks;
    }

    /**
     * Returns the text of this content, joining every text and text delta block in order.
     *
     * @throws IllegalStateException if the content holds no text at all
     */
    public String flattenIntoText() {
        if (isText()) {
            return text;
        }
        StringBuilder sb = new StringBuilder();
        boolean found = false;
        for (ContentBlock block : blocks) {
            if (block instanceof TextContentBlock) {
                sb.append(((TextContentBlock) block).getText());
                found = true;
            } else if (block instanceof TextDeltaContentBlock) {
                sb.append(((TextDeltaContentBlock) block).getText());
                found = true;
            }
        }
        if (!found) {
            throw new IllegalStateException("Content has no text blocks: " + blocks.size() + " non-text block(s)");
        }
        return sb.toString();
    }

    /**
     * Returns the value Jackson writes: the text, or the list of blocks.
     */
    @JsonValue
    public Object toJsonValue() {
        return isText() ? text : blocks;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Content content = (Content) o;
        return Objects.equals(text, content.text) && Objects.equals(blocks, content.blocks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, blocks);
    }

    @Override
    public String toString() {
        return MessagesJson.pretty(this);
    }

    /**
     * Accepts a JSON string or an array of tagged content blocks.
     */
    public static final class Deserializer extends StdDeserializer<Content> {

        public Deserializer() {
            super(Content.class);
        }

        @Override
        public Content deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonToken token = p.currentToken();
            if (token == JsonToken.VALUE_STRING) {
                return Content.text(p.getText());
            }
            if (token == JsonToken.START_ARRAY) {
                JavaType listType = ctxt.getTypeFactory().constructCollectionType(List.class, ContentBlock.class);
                List<ContentBlock> blocks = ctxt.readValue(p, listType);
                if (blocks.contains(null)) {
                    return ctxt.reportInputMismatch(this, "Content blocks must not be null");
                }
                return Content.blocks(blocks);
            }
            return (Content) ctxt.handleUnexpectedToken(Content.class, p);
        }
    }
}
