package com.subscription.billing.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Platform discriminator sent with a client receipt.
 */
public enum ReceiptPlatform {
    ANDROID("android", ProviderType.GOOGLE_PLAY),
    IOS("ios", ProviderType.APPLE_APPSTORE);

    private final String token;
    private final ProviderType providerType;

    ReceiptPlatform(String token, ProviderType providerType) {
        this.token = token;
        this.providerType = providerType;
    }

    @JsonValue
    public String getToken() {
        return token;
    }

    public ProviderType getProviderType() {
        return providerType;
    }

    @JsonCreator
    public static ReceiptPlatform of(String token) {
        for (ReceiptPlatform platform : values()) {
            if (platform.token.equalsIgnoreCase(token) || platform.name().equalsIgnoreCase(token)) {
                return platform;
            }
        }
        throw new IllegalArgumentException("Unknown receipt platform: " + token);
    }
}
