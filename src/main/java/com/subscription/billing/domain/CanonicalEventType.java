package com.subscription.billing.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Provider-agnostic event vocabulary the state machine understands.
 */
public enum CanonicalEventType {
    CREATED("created"),
    AUTHENTICATED("authenticated"),
    ACTIVATED("activated"),
    CHARGED("charged"),
    CANCELLED("cancelled"),
    PAUSED("paused"),
    RESUMED("resumed"),
    COMPLETED("completed"),
    /** Payment retry in progress. Audit only. */
    PENDING("pending"),
    /** Metadata refresh; may carry provider truth for status correction. */
    UPDATED("updated"),
    EXPIRED("expired");

    private final String token;

    CanonicalEventType(String token) {
        this.token = token;
    }

    @JsonValue
    public String getToken() {
        return token;
    }
}
