package com.subscription.billing.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A provider signal translated into the canonical vocabulary. Every field besides
 * provider, type and providerSubscriptionId is optional.
 */
@Value
@Builder(toBuilder = true)
public class CanonicalEvent {

    ProviderType provider;
    CanonicalEventType type;
    String providerSubscriptionId;

    /** Provider-assigned id of the delivery (Razorpay event id, Pub/Sub message id, notificationUUID). */
    String providerEventId;
    /** Native event name, e.g. "subscription.charged" or "DID_RENEW". */
    String nativeEventType;
    /** When the provider says the event happened. */
    Instant occurredAt;

    /** Status the provider reports alongside the event, if any. */
    SubscriptionStatus providerStatus;
    Boolean cancelAtCycleEnd;
    String cancellationReason;

    String providerPlanId;
    Instant periodStart;
    Instant periodEnd;
    Instant nextBillingAt;
    Integer totalCount;
    Integer paidCount;
    Integer remainingCount;

    PaymentSnapshot payment;

    /** The authoritative state must be fetched from the provider before this event is meaningful. */
    boolean requiresProviderFetch;

    Map<String, Object> payload;

    /**
     * Natural idempotency key: the provider's delivery id when present, otherwise event type
     * plus period bounds.
     */
    public String idempotencyKey(UUID subscriptionId) {
        if (providerEventId != null && !providerEventId.isBlank()) {
            return subscriptionId + ":" + providerEventId;
        }
        return subscriptionId + ":" + type.getToken()
                + ":" + (periodStart != null ? periodStart.getEpochSecond() : "-")
                + ":" + (periodEnd != null ? periodEnd.getEpochSecond() : "-")
                + ":" + (occurredAt != null ? occurredAt.getEpochSecond() : "-");
    }
}
