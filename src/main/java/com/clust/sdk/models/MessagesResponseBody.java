package com.clust.sdk.models;

import com.clust.sdk.json.MessagesJson;
import com.clust.sdk.models.content.Content;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Response body of the Messages API, also carried by the {@code message_start} stream chunk.
 */
@JsonPropertyOrder({"id", "type", "role", "content", "model", "stop_reason", "stop_sequence", "usage"})
public class MessagesResponseBody {

    /**
     * Unique object identifier. The format and length of IDs may change over time.
     */
    @JsonProperty("id")
    private final String id;

    @JsonProperty("type")
    private final MessageObjectType type;

    /**
     * Always {@code assistant}.
     */
    @JsonProperty("role")
    private final Role role;

    @JsonProperty("content")
    private final Content content;

    @JsonProperty("model")
    private final ClaudeModel model;

    /**
     * Non-null in non-streaming mode. In streaming mode it is null in {@code message_start}
     * and non-null otherwise.
     */
    @JsonProperty("stop_reason")
    private final StopReason stopReason;

    /**
     * The custom stop sequence that was generated, if any.
     */
    @JsonProperty("stop_sequence")
    private final String stopSequence;

    @JsonProperty("usage")
    private final Usage usage;

    @JsonCreator
    public MessagesResponseBody(@JsonProperty(value = "id", required = true) String id,
                                @JsonProperty(value = "type", required = true) MessageObjectType type,
                                @JsonProperty(value = "role", required = true) Role role,
                                @JsonProperty(value = "content", required = true) Content content,
                                @JsonProperty(value = "model", required = true) ClaudeModel model,
                                @JsonProperty("stop_reason") StopReason stopReason,
                                @JsonProperty("stop_sequence") String stopSequence,
                                @JsonProperty(value = "usage", required = true) Usage usage) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.role = Objects.requireNonNull(role, "role must not be null");
        this.content = Objects.requireNonNull(content, "content must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.stopReason = stopReason;
        this.stopSequence = stopSequence;
        this.usage = Objects.requireNonNull(usage, "usage must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() {
        return id;
    }

    public MessageObjectType getType() {
        return type;
    }

    public Role getRole() {
        return role;
    }

    public Content getContent() {
        return content;
    }

    public ClaudeModel getModel() {
        return model;
    }

    public StopReason getStopReason() {
        return stopReason;
    }

    public String getStopSequence() {
        return stopSequence;
    }

    public Usage getUsage() {
        return usage;
    }

    /**
     * Turns this response into a message that can be appended to the conversation.
     */
    public Message toMessage() {
        return new Message(role, content);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MessagesResponseBody that = (MessagesResponseBody) o;
        return Objects.equals(id, that.id)
                && type == that.type
                && role == that.role
                && Objects.equals(content, that.content)
                && model == that.model
                && stopReason == that.stopReason
                && Objects.equals(stopSequence, that.stopSequence)
                && Objects.equals(usage, that.usage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, role, content, model, stopReason, stopSequence, usage);
    }

    @Override
    public String toString() {
        return MessagesJson.pretty(this);
    }

    /**
     * Builder for creating MessagesResponseBody instances.
     */
    public static class Builder {
        private String id;
        private Role role = Role.ASSISTANT;
        private Content content;
        private ClaudeModel model;
        private StopReason stopReason;
        private String stopSequence;
        private Usage usage;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder role(Role role) {
            this.role = role;
            return this;
        }

        public Builder content(Content content) {
            this.content = content;
            return this;
        }

        public Builder content(String text) {
            this.content = Content.text(text);
            return this;
        }

        public Builder model(ClaudeModel model) {
            this.model = model;
            return this;
        }

        public Builder stopReason(StopReason stopReason) {
            this.stopReason = stopReason;
            return this;
        }

        public Builder stopSequence(String stopSequence) {
            this.stopSequence = stopSequence;
            return this;
        }

        public Builder usage(Usage usage) {
            this.usage = usage;
            return this;
        }

        /**
         * Builds the response body.
         *
         * @throws NullPointerException if id, role, content, model or usage is missing
         */
        public MessagesResponseBody build() {
            return new MessagesResponseBody(id, MessageObjectType.MESSAGE, role, content, model,
                    stopReason, stopSequence, usage);
        }
    }
}
