package com.subscription.billing.messaging;

import com.subscription.billing.domain.SubscriptionStatus;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Emitted to Kafka after every applied subscription transition, for usage and revenue tracking.
 */
@Value
@Builder
@Jacksonized
public class SubscriptionEvent {

    String eventId;
    String subscriptionId;
    String userId;
    String provider;
    String providerSubscriptionId;
    /** Canonical event type, e.g. "charged". */
    String eventType;
    SubscriptionStatus previousStatus;
    SubscriptionStatus newStatus;
    Long amountMinor;
    String currency;
    Instant timestamp;
}
