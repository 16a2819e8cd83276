package com.clust.sdk.models;

import com.clust.sdk.json.MessagesJson;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Request body for the Messages API. Unset optional fields are left out of the JSON.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * MessagesRequestBody body = MessagesRequestBody.builder()
 *     .model(ClaudeModel.CLAUDE_3_HAIKU_20240307)
 *     .system("You are a helpful assistant.")
 *     .addMessage(Message.user("Hello, Claude"))
 *     .maxTokens(1024)
 *     .build();
 * }</pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"model", "messages", "system", "max_tokens", "metadata", "stop_sequences",
        "stream", "temperature", "top_p", "top_k"})
public class MessagesRequestBody {

    public static final int DEFAULT_MAX_TOKENS = 4096;

    @JsonProperty("model")
    private final ClaudeModel model;

    @JsonProperty("messages")
    private final List<Message> messages;

    @JsonProperty("system")
    private final String system;

    @JsonProperty("max_tokens")
    private final int maxTokens;

    @JsonProperty("metadata")
    private final Metadata metadata;

    @JsonProperty("stop_sequences")
    private final List<String> stopSequences;

    @JsonProperty("stream")
    private final StreamOption stream;

    @JsonProperty("temperature")
    private final Double temperature;

    @JsonProperty("top_p")
    private final Double topP;

    @JsonProperty("top_k")
    private final Integer topK;

    /**
     * Creates a request body, checking the same constraints as {@link Builder#build()}.
     *
     * @throws IllegalArgumentException if a required field is missing or a value is out of range
     */
    @JsonCreator
    private MessagesRequestBody(@JsonProperty(value = "model", required = true) ClaudeModel model,
                                @JsonProperty(value = "messages", required = true) List<Message> messages,
                                @JsonProperty("system") String system,
                                @JsonProperty(value = "max_tokens", required = true) int maxTokens,
                                @JsonProperty("metadata") Metadata metadata,
                                @JsonProperty("stop_sequences") List<String> stopSequences,
                                @JsonProperty("stream") StreamOption stream,
                                @JsonProperty("temperature") Double temperature,
                                @JsonProperty("top_p") Double topP,
                                @JsonProperty("top_k") Integer topK) {
        if (model == null) {
            throw new IllegalArgumentException("model is required");
        }
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("at least one message is required");
        }
        if (messages.contains(null)) {
            throw new IllegalArgumentException("messages must not contain null");
        }
        if (maxTokens < 1 || maxTokens > model.getMaxTokens()) {
            throw new IllegalArgumentException("max_tokens must be between 1 and " + model.getMaxTokens()
                    + " for " + model + ": " + maxTokens);
        }
        checkUnitRange("temperature", temperature);
        checkUnitRange("top_p", topP);
        if (topK != null && topK < 0) {
            throw new IllegalArgumentException("top_k must not be negative: " + topK);
        }
        if (stopSequences != null && stopSequences.contains(null)) {
            throw new IllegalArgumentException("stop_sequences must not contain null");
        }

        this.model = model;
        this.messages = List.copyOf(messages);
        this.system = system;
        this.maxTokens = maxTokens;
        this.metadata = metadata;
        this.stopSequences = stopSequences == null ? null : List.copyOf(stopSequences);
        this.stream = stream;
        this.temperature = temperature;
        this.topP = topP;
        this.topK = topK;
    }

    private static void checkUnitRange(String name, Double value) {
        if (value != null && !(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(name + " must be between 0.0 and 1.0: " + value);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public ClaudeModel getModel() {
        return model;
    }

    public List<Message> getMessages() {
        return messages;
    }

    public String getSystem() {
        return system;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public Metadata getMetadata() {
        return metadata;
    }

    public List<String> getStopSequences() {
        return stopSequences;
    }

    public StreamOption getStream() {
        return stream;
    }

    /**
     * Returns true if this request asks for a server-sent event stream.
     */
    @JsonIgnore
    public boolean isStreaming() {
        return stream == StreamOption.RETURN_STREAM;
    }

    public Double getTemperature() {
        return temperature;
    }

    public Double getTopP() {
        return topP;
    }

    public Integer getTopK() {
        return topK;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MessagesRequestBody that = (MessagesRequestBody) o;
        return maxTokens == that.maxTokens
                && model == that.model
                && Objects.equals(messages, that.messages)
                && Objects.equals(system, that.system)
                && Objects.equals(metadata, that.metadata)
                && Objects.equals(stopSequences, that.stopSequences)
                && stream == that.stream
                && Objects.equals(temperature, that.temperature)
                && Objects.equals(topP, that.topP)
                && Objects.equals(topK, that.topK);
    }

    @Override
    public int hashCode() {
        return Objects.hash(model, messages, system, maxTokens, metadata, stopSequences, stream,
                temperature, topP, topK);
    }

    @Override
    public String toString() {
        return MessagesJson.pretty(this);
    }

    /**
     * Builder for creating MessagesRequestBody instances.
     */
    public static class Builder {
        private ClaudeModel model;
        private final List<Message> messages = new ArrayList<>();
        private String system;
        private Integer maxTokens;
        private Metadata metadata;
        private List<String> stopSequences;
        private StreamOption stream;
        private Double temperature;
        private Double topP;
        private Integer topK;

        public Builder model(ClaudeModel model) {
            this.model = Objects.requireNonNull(model, "model must not be null");
            return this;
        }

        public Builder messages(List<Message> messages) {
            Objects.requireNonNull(messages, "messages must not be null");
            this.messages.clear();
            this.messages.addAll(messages);
            return this;
        }

        public Builder addMessage(Message message) {
            this.messages.add(Objects.requireNonNull(message, "message must not be null"));
            return this;
        }

        public Builder system(String system) {
            this.system = system;
            return this;
        }

        public Builder maxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder metadata(Metadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder stopSequences(List<String> stopSequences) {
            this.stopSequences = stopSequences == null ? null : List.copyOf(stopSequences);
            return this;
        }

        public Builder stream(StreamOption stream) {
            this.stream = stream;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder topP(Double topP) {
            this.topP = topP;
            return this;
        }

        public Builder topK(Integer topK) {
            this.topK = topK;
            return this;
        }

        /**
         * Builds the request body.
         *
         * @throws IllegalArgumentException if a required field is missing or a value is out of range
         */
        public MessagesRequestBody build() {
            int tokens = DEFAULT_MAX_TOKENS;
            if (maxTokens != null) {
                tokens = maxTokens;
            } else if (model != null) {
                tokens = Math.min(DEFAULT_MAX_TOKENS, model.getMaxTokens());
            }
            return new MessagesRequestBody(model, messages, system, tokens, metadata, stopSequences, stream,
                    temperature, topP, topK);
        }
    }
}
