package com.subscription.billing.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Live subscription state as reported by the provider. Not persisted.
 */
@Value
@Builder
public class ProviderSubscriptionDetails {

    ProviderType provider;
    String providerSubscriptionId;
    SubscriptionStatus status;
    String planId;
    Instant currentPeriodStart;
    Instant currentPeriodEnd;
    Instant nextBillingAt;
    Integer totalCount;
    Integer paidCount;
    Integer remainingCount;
    Boolean autoRenewing;
    Map<String, Object> metadata;
}
