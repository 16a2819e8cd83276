package com.clust.sdk.streaming;

import com.clust.sdk.exceptions.ApiErrors;
import com.clust.sdk.exceptions.DecodingException;
import com.clust.sdk.json.MessagesJson;
import com.clust.sdk.models.ErrorResponseBody;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes stream chunks from the lines of a server-sent event stream.
 *
 * <p>Only the {@code data:} field carries a chunk. The {@code event:} field repeats the
 * chunk's {@code type} and is skipped, as are comments, {@code id:}, {@code retry:} and
 * blank lines. Reading the stream off the wire is up to the caller.</p>
 */
public final class StreamChunks {

    private static final Logger logger = LoggerFactory.getLogger(StreamChunks.class);

    private static final String DATA_FIELD = "data:";

    private StreamChunks() {}

    /**
     * Decodes one line of an event stream.
     *
     * @return the chunk, or null if the line carries no data
     * @throws com.clust.sdk.exceptions.ClaudeException mapped from the error if the line is an {@code error} event
     * @throws DecodingException if the line is not an event-stream field or its data is not a known chunk
     */
    public static StreamChunk parseLine(String line) {
        if (line == null) {
            return null;
        }
        String trimmed = line.strip();
        if (trimmed.isEmpty() || trimmed.startsWith(":")) {
            return null;
        }
        if (trimmed.startsWith("event:") || trimmed.startsWith("id:") || trimmed.startsWith("retry:")) {
            logger.trace("Skipping stream field: {}", trimmed);
            return null;
        }
        if (!trimmed.startsWith(DATA_FIELD)) {
            throw new DecodingException(StreamChunk.class, "not an event-stream line: " + line);
        }

        String data = trimmed.substring(DATA_FIELD.length()).strip();
        JsonNode node;
        try {
            node = MessagesJson.objectMapper().readTree(data);
        } catch (JsonProcessingException e) {
            throw new DecodingException(StreamChunk.class, e);
        }
        if (node != null && ErrorResponseBody.TYPE.equals(node.path("type").asText())) {
            ErrorResponseBody error = MessagesJson.decode(data, ErrorResponseBody.class);
            logger.warn("Received error event in stream: {}", data);
            throw ApiErrors.fromError(error);
        }
        return MessagesJson.decode(data, StreamChunk.class);
    }

    /**
     * Decodes every chunk of an event stream that has already been received in full.
     */
    public static List<StreamChunk> parseAll(String eventStream) {
        List<StreamChunk> chunks = new ArrayList<>();
        for (String line : eventStream.split("\\r?\\n")) {
            StreamChunk chunk = parseLine(line);
            if (chunk != null) {
                chunks.add(chunk);
            }
        }
        logger.debug("Decoded {} stream chunks", chunks.size());
        return chunks;
    }
}
