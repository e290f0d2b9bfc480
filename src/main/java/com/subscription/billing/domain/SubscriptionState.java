package com.subscription.billing.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * The part of a subscription the state machine reads and writes.
 */
@Value
@Builder(toBuilder = true)
public class SubscriptionState {

    SubscriptionStatus status;
    String providerPlanId;
    Instant currentPeriodStart;
    Instant currentPeriodEnd;
    Instant nextBillingAt;
    Integer totalCount;
    int paidCount;
    Integer remainingCount;
    boolean cancelAtCycleEnd;
    String cancellationReason;
    Instant cancelledAt;
    /** Newest provider event timestamp applied so far. */
    Instant lastEventAt;
}
