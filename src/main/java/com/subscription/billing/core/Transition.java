package com.subscription.billing.core;

import com.subscription.billing.core.exception.StateConflictException;
import com.subscription.billing.domain.CanonicalEventType;
import com.subscription.billing.domain.SubscriptionState;
import com.subscription.billing.domain.SubscriptionStatus;
import com.subscription.billing.domain.TransitionOutcome;
import lombok.Value;

/**
 * Result of applying one canonical event. {@code state} is the state to persist; for anything
 * but {@link TransitionOutcome#APPLIED} it is the unchanged input.
 */
@Value
public class Transition {

    TransitionOutcome outcome;
    CanonicalEventType eventType;
    SubscriptionStatus previousStatus;
    SubscriptionState state;
    String note;

    public boolean isApplied() {
        return outcome == TransitionOutcome.APPLIED;
    }

    public SubscriptionStatus getNewStatus() {
        return state.getStatus();
    }

    /**
     * For callers that must not record a conflict, e.g. user-initiated operations.
     */
    public Transition orThrow() {
        if (outcome == TransitionOutcome.CONFLICT) {
            throw new StateConflictException(previousStatus, eventType);
        }
        return this;
    }
}
