package com.clust.sdk.json;

import com.clust.sdk.exceptions.DecodingException;
import com.clust.sdk.models.Usage;
import com.fasterxml.jackson.databind.DeserializationFeature;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MessagesJsonTest {

    @Test
    void testUnknownPropertiesAreIgnored() {
        assertFalse(MessagesJson.objectMapper().isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
        assertEquals(new Usage(1, 2), MessagesJson.decode(
                "{\"input_tokens\":1,\"output_tokens\":2,\"cache_read_input_tokens\":0}", Usage.class));
    }

    @Test
    void testDecodeInvalidJson() {
        DecodingException ex = assertThrows(DecodingException.class,
                () -> MessagesJson.decode("{\"input_tokens\":", Usage.class));

        assertEquals(Usage.class, ex.getTargetType());
        assertTrue(ex.getMessage().startsWith("Failed to decode Usage: "));
        assertNotNull(ex.getCause());
    }

    @Test
    void testDecodeWrongShape() {
        assertThrows(DecodingException.class, () -> MessagesJson.decode("[1, 2]", Usage.class));
        assertThrows(DecodingException.class, () -> MessagesJson.decode("{\"input_tokens\":\"many\"}", Usage.class));
    }

    @Test
    void testNullDocumentIsRejected() {
        DecodingException ex = assertThrows(DecodingException.class, () -> MessagesJson.decode("null", Usage.class));

        assertEquals(Usage.class, ex.getTargetType());
        assertEquals("Failed to decode Usage: null document", ex.getMessage());
    }

    @Test
    void testMissingOrNullPrimitivesAreRejected() {
        assertTrue(MessagesJson.objectMapper().isEnabled(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES));
        assertThrows(DecodingException.class, () -> MessagesJson.decode("{\"input_tokens\":1}", Usage.class));
        assertThrows(DecodingException.class,
                () -> MessagesJson.decode("{\"input_tokens\":1,\"output_tokens\":null}", Usage.class));
    }

    @Test
    void testPrettyLayout() {
        Map<String, Object> value = Map.of("list", List.of(1, 2));

        assertEquals("{\n  \"list\": [\n    1,\n    2\n  ]\n}", MessagesJson.pretty(value));
    }

    @Test
    void testEncodeIsCompact() {
        assertEquals("{\"input_tokens\":3,\"output_tokens\":4}", MessagesJson.encode(new Usage(3, 4)));
    }
}
