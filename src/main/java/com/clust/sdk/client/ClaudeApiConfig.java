package com.clust.sdk.client;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration for requests to the Messages API.
 */
public class ClaudeApiConfig {

    public static final String DEFAULT_BASE_URL = "https://api.anthropic.com";
    public static final String DEFAULT_API_VERSION = "2023-06-01";

    static final String API_KEY_ENV = "ANTHROPIC_API_KEY";
    static final String BASE_URL_ENV = "ANTHROPIC_BASE_URL";
    static final String API_VERSION_ENV = "ANTHROPIC_VERSION";

    private final String baseUrl;
    private final String apiKey;
    private final String apiVersion;
    private final List<String> betas;

    private ClaudeApiConfig(Builder builder) {
        this.baseUrl = builder.baseUrl;
        this.apiKey = builder.apiKey;
        this.apiVersion = builder.apiVersion;
        this.betas = List.copyOf(builder.betas);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a configuration from the process environment.
     */
    public static ClaudeApiConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Creates a configuration from {@code ANTHROPIC_API_KEY}, {@code ANTHROPIC_BASE_URL} and
     * {@code ANTHROPIC_VERSION}. Only the API key is required.
     *
     * @throws IllegalStateException if the API key is not set
     */
    public static ClaudeApiConfig fromEnvironment(Map<String, String> env) {
        String apiKey = env.get(API_KEY_ENV);
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException(API_KEY_ENV + " is not set");
        }
        Builder builder = builder().apiKey(apiKey);
        String baseUrl = env.get(BASE_URL_ENV);
        if (baseUrl != null && !baseUrl.isBlank()) {
            builder.baseUrl(baseUrl);
        }
        String apiVersion = env.get(API_VERSION_ENV);
        if (apiVersion != null && !apiVersion.isBlank()) {
            builder.apiVersion(apiVersion);
        }
        return builder.build();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public String getApiVersion() {
        return apiVersion;
    }

    public List<String> getBetas() {
        return betas;
    }

    @Override
    public String toString() {
        return "ClaudeApiConfig{" +
                "baseUrl='" + baseUrl + '\'' +
                ", apiVersion='" + apiVersion + '\'' +
                ", betas=" + betas +
                '}';
    }

    /**
     * Builder for creating ClaudeApiConfig instances.
     */
    public static class Builder {
        private String baseUrl = DEFAULT_BASE_URL;
        private String apiKey;
        private String apiVersion = DEFAULT_API_VERSION;
        private List<String> betas = List.of();

        public Builder baseUrl(String baseUrl) {
            Objects.requireNonNull(baseUrl, "baseUrl must not be null");
            this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = Objects.requireNonNull(apiKey, "apiKey must not be null");
            return this;
        }

        public Builder apiVersion(String apiVersion) {
            this.apiVersion = Objects.requireNonNull(apiVersion, "apiVersion must not be null");
            return this;
        }

        public Builder betas(List<String> betas) {
            this.betas = Objects.requireNonNull(betas, "betas must not be null");
            return this;
        }

        public ClaudeApiConfig build() {
            if (apiKey == null) {
                throw new IllegalStateException("apiKey is required");
            }
            return new ClaudeApiConfig(this);
        }
    }
}
