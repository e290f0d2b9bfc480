package com.subscription.billing.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Canonical subscription lifecycle states shared by every provider.
 */
public enum SubscriptionStatus {
    CREATED("created"),
    AUTHENTICATED("authenticated"),
    ACTIVE("active"),
    PENDING_CANCELLATION("pending_cancellation"),
    PAUSED("paused"),
    CANCELLED("cancelled"),
    COMPLETED("completed"),
    EXPIRED("expired");

    private static final Set<SubscriptionStatus> TERMINAL = EnumSet.of(CANCELLED, COMPLETED, EXPIRED);
    private static final Set<SubscriptionStatus> OCCUPYING = EnumSet.of(ACTIVE, AUTHENTICATED, PENDING_CANCELLATION);

    private final String token;

    SubscriptionStatus(String token) {
        this.token = token;
    }

    @JsonValue
    public String getToken() {
        return token;
    }

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /** States that block creating another subscription for the same user. */
    public boolean blocksNewSubscription() {
        return OCCUPYING.contains(this);
    }

    /** Whether the user still has access to paid features. */
    public boolean grantsAccess() {
        return this == ACTIVE || this == PENDING_CANCELLATION;
    }

    @JsonCreator
    public static SubscriptionStatus of(String token) {
        return Arrays.stream(values())
                .filter(s -> s.token.equalsIgnoreCase(token) || s.name().equalsIgnoreCase(token))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown subscription status: " + token));
    }
}
