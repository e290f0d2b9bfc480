package com.subscription.billing.core;

import com.subscription.billing.domain.SubscriptionStatus;
import com.subscription.billing.domain.TransitionOutcome;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

/**
 * What the fast idempotency cache remembers about an event already written to the ledger.
 */
@Value
@Builder
@Jacksonized
public class ProcessedEventMarker {

    String idempotencyKey;
    UUID subscriptionId;
    TransitionOutcome outcome;
    SubscriptionStatus newStatus;
    Instant processedAt;
}
