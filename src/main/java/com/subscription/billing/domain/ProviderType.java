package com.subscription.billing.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Supported subscription backends. The token is the value stored in the database
 * and accepted on the API (e.g. "razorpay").
 */
public enum ProviderType {
    /** Hosted-checkout recurring billing (Razorpay subscriptions). */
    RAZORPAY("razorpay"),
    /** Android in-app purchases (Google Play Developer API). */
    GOOGLE_PLAY("google_play"),
    /** iOS in-app purchases (App Store receipts and server notifications). */
    APPLE_APPSTORE("apple_appstore");

    private final String token;

    ProviderType(String token) {
        this.token = token;
    }

    @JsonValue
    public String getToken() {
        return token;
    }

    public boolean isStore() {
        return this != RAZORPAY;
    }

    public static Optional<ProviderType> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String normalized = token.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(t -> t.token.equals(normalized) || t.name().equalsIgnoreCase(normalized))
                .findFirst();
    }

    @JsonCreator
    public static ProviderType of(String token) {
        return fromToken(token)
                .orElseThrow(() -> new IllegalArgumentException("Unknown provider type: " + token));
    }
}
