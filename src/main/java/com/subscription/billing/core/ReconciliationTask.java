package com.subscription.billing.core;

import com.subscription.billing.domain.CanonicalEvent;
import com.subscription.billing.domain.ProviderType;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * A provider fetch to run later. When {@code pendingEvent} is set, the fetched state completes that
 * event before it is recorded; otherwise the fetch is recorded as an {@code updated} event.
 */
@Value
@Builder
public class ReconciliationTask {

    ProviderType provider;
    UUID subscriptionId;
    String providerSubscriptionId;
    /** Inbox row to settle when the task finishes, if the task came from a webhook. */
    UUID webhookEventId;
    CanonicalEvent pendingEvent;
    String reason;
}
