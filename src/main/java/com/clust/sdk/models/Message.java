package com.clust.sdk.models;

import com.clust.sdk.json.MessagesJson;
import com.clust.sdk.models.content.Content;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * One turn of a conversation sent to the Messages API.
 */
@JsonPropertyOrder({"role", "content"})
public class Message {

    @JsonProperty("role")
    private final Role role;

    @JsonProperty("content")
    private final Content content;

    @JsonCreator
    public Message(@JsonProperty(value = "role", required = true) Role role,
                   @JsonProperty(value = "content", required = true) Content content) {
        this.role = Objects.requireNonNull(role, "role must not be null");
        this.content = Objects.requireNonNull(content, "content must not be null");
    }

    public static Message user(String text) {
        return new Message(Role.USER, Content.text(text));
    }

    public static Message user(Content content) {
        return new Message(Role.USER, content);
    }

    public static Message assistant(String text) {
        return new Message(Role.ASSISTANT, Content.text(text));
    }

    public static Message assistant(Content content) {
        return new Message(Role.ASSISTANT, content);
    }

    public Role getRole() {
        return role;
    }

    public Content getContent() {
        return content;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Message message = (Message) o;
        return role == message.role && Objects.equals(content, message.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, content);
    }

    @Override
    public String toString() {
        return MessagesJson.pretty(this);
    }
}
