package com.subscription.billing.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Authoritative view of a store receipt after the provider lookup.
 * Trial and intro-offer flags are informational for analytics and do not drive state.
 */
@Value
@Builder
public class ReceiptValidationResult {

    ProviderType provider;
    boolean valid;
    SubscriptionStatus status;
    /** Google purchase token or Apple original transaction id. */
    String providerSubscriptionId;
    String productId;
    String transactionId;
    Instant purchaseDate;
    Instant expiryDate;
    boolean autoRenewing;
    boolean trial;
    boolean introOffer;
    Map<String, Object> metadata;

    public boolean isExpired(Instant now) {
        return expiryDate != null && expiryDate.isBefore(now);
    }
}
