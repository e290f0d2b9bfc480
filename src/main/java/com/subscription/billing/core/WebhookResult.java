package com.subscription.billing.core;

import com.subscription.billing.domain.SubscriptionStatus;
import com.subscription.billing.domain.TransitionOutcome;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * What happened to an authenticated notification. Every status here is acknowledged to the provider.
 */
@Value
@Builder
public class WebhookResult {

    public enum Status {
        PROCESSED,
        DUPLICATE,
        IGNORED,
        /** Waiting on a provider fetch. */
        DEFERRED,
        UNKNOWN_SUBSCRIPTION
    }

    Status status;
    UUID subscriptionId;
    TransitionOutcome outcome;
    SubscriptionStatus subscriptionStatus;

    public static WebhookResult of(Status status) {
        return WebhookResult.builder().status(status).build();
    }
}
