package com.clust.sdk.models;

import com.clust.sdk.json.MessagesJson;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Request metadata.
 */
public class Metadata {

    /**
     * An external identifier for the end user, such as a UUID or hash. Must not contain
     * identifying information like a name, email address or phone number.
     */
    @JsonProperty("user_id")
    private String userId;

    // Default constructor for Jackson
    public Metadata() {}

    public Metadata(String userId) {
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(userId, ((Metadata) o).userId);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(userId);
    }

    @Override
    public String toString() {
        return MessagesJson.pretty(this);
    }
}
