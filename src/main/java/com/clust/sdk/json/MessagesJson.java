package com.clust.sdk.json;

import com.clust.sdk.exceptions.DecodingException;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import java.io.IOException;

/**
 * Shared JSON codec for every Messages API model.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * MessagesResponseBody body = MessagesJson.decode(json, MessagesResponseBody.class);
 * String compact = MessagesJson.encode(body);
 * String readable = MessagesJson.pretty(body);
 * }</pre>
 */
public final class MessagesJson {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);

    private static final ObjectWriter PRETTY_WRITER = OBJECT_MAPPER.writer(new ReadablePrinter());

    private MessagesJson() {}

    /**
     * Returns the mapper used for all encoding and decoding.
     */
    public static ObjectMapper objectMapper() {
        return OBJECT_MAPPER;
    }

    /**
     * Encodes a value into compact JSON.
     */
    public static String encode(Object value) {
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + describe(value) + ": " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Decodes JSON into the given type.
     *
     * @throws DecodingException if the JSON does not match the expected shape or is {@code null}
     */
    public static <T> T decode(String json, Class<T> type) {
        T value;
        try {
            value = OBJECT_MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new DecodingException(type, e);
        }
        if (value == null) {
            throw new DecodingException(type, "null document");
        }
        return value;
    }

    /**
     * Renders a value as indented JSON for logs and debugging.
     */
    public static String pretty(Object value) {
        try {
            return PRETTY_WRITER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render " + describe(value) + ": " + e.getOriginalMessage(), e);
        }
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    /**
     * Two-space indentation, {@code ": "} between names and values, one array element per line.
     */
    private static final class ReadablePrinter extends DefaultPrettyPrinter {

        ReadablePrinter() {
            DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
            indentObjectsWith(indenter);
            indentArraysWith(indenter);
        }

        private ReadablePrinter(ReadablePrinter base) {
            super(base);
        }

        @Override
        public DefaultPrettyPrinter createInstance() {
            return new ReadablePrinter(this);
        }

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }
    }
}
