package com.subscription.billing.persistence.service;

import com.subscription.billing.domain.CanonicalEventType;
import com.subscription.billing.domain.ProviderType;
import com.subscription.billing.domain.SubscriptionStatus;
import com.subscription.billing.domain.TransitionOutcome;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * What one ledger write did. {@link TransitionOutcome#DUPLICATE} means nothing was written.
 */
@Value
@Builder
public class LedgerResult {

    UUID subscriptionId;
    String userId;
    ProviderType provider;
    String providerSubscriptionId;
    String idempotencyKey;
    CanonicalEventType eventType;
    TransitionOutcome outcome;
    SubscriptionStatus previousStatus;
    SubscriptionStatus newStatus;
    String note;

    public boolean isApplied() {
        return outcome == TransitionOutcome.APPLIED;
    }

    public boolean isDuplicate() {
        return outcome == TransitionOutcome.DUPLICATE;
    }
}
