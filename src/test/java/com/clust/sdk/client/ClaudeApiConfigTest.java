package com.clust.sdk.client;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ClaudeApiConfigTest {

    @Test
    void testDefaults() {
        ClaudeApiConfig config = ClaudeApiConfig.builder().apiKey("sk-test").build();

        assertEquals("https://api.anthropic.com", config.getBaseUrl());
        assertEquals("2023-06-01", config.getApiVersion());
        assertEquals("sk-test", config.getApiKey());
        assertTrue(config.getBetas().isEmpty());
    }

    @Test
    void testBuilder() {
        ClaudeApiConfig config = ClaudeApiConfig.builder()
                .apiKey("sk-test")
                .baseUrl("http://localhost:8080/")
                .apiVersion("2024-01-01")
                .betas(List.of("tools-2024-04-04"))
                .build();

        assertEquals("http://localhost:8080", config.getBaseUrl());
        assertEquals("2024-01-01", config.getApiVersion());
        assertEquals(List.of("tools-2024-04-04"), config.getBetas());
        assertFalse(config.toString().contains("sk-test"));
    }

    @Test
    void testApiKeyIsRequired() {
        assertThrows(IllegalStateException.class, () -> ClaudeApiConfig.builder().build());
        assertThrows(NullPointerException.class, () -> ClaudeApiConfig.builder().baseUrl(null));
    }

    @Test
    void testFromEnvironment() {
        ClaudeApiConfig config = ClaudeApiConfig.fromEnvironment(Map.of(
                "ANTHROPIC_API_KEY", "sk-env",
                "ANTHROPIC_BASE_URL", "http://proxy.local"));

        assertEquals("sk-env", config.getApiKey());
        assertEquals("http://proxy.local", config.getBaseUrl());
        assertEquals(ClaudeApiConfig.DEFAULT_API_VERSION, config.getApiVersion());

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> ClaudeApiConfig.fromEnvironment(Map.of()));
        assertTrue(ex.getMessage().contains("ANTHROPIC_API_KEY"));
    }
}
