package com.subscription.billing.domain;

/**
 * How the ledger recorded an event.
 */
public enum TransitionOutcome {
    /** State (or billing bookkeeping) changed. */
    APPLIED,
    /** Accepted, but the subscription was already in the target state. */
    NO_CHANGE,
    /** Older than what was already applied; recorded without mutation. */
    STALE,
    /** Contradicts the persisted state; recorded and queued for provider reconciliation. */
    CONFLICT,
    /** Same idempotency key seen before; nothing recorded. */
    DUPLICATE
}
