package com.subscription.billing.core.exception;

import com.subscription.billing.domain.CanonicalEventType;
import com.subscription.billing.domain.SubscriptionStatus;

/**
 * An event contradicts the persisted state. Recorded, never retried; provider reconciliation
 * or manual review decides the outcome.
 */
public class StateConflictException extends BillingException {

    public static final String CODE = "STATE_CONFLICT";

    private final SubscriptionStatus currentStatus;
    private final CanonicalEventType eventType;

    public StateConflictException(SubscriptionStatus currentStatus, CanonicalEventType eventType) {
        super("Event " + eventType.getToken() + " is not allowed while subscription is " + currentStatus.getToken(),
                CODE, null, 409);
        this.currentStatus = currentStatus;
        this.eventType = eventType;
    }

    public SubscriptionStatus getCurrentStatus() {
        return currentStatus;
    }

    public CanonicalEventType getEventType() {
        return eventType;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
