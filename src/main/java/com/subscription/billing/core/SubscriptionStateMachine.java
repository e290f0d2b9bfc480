package com.subscription.billing.core;

import com.subscription.billing.domain.CanonicalEvent;
import com.subscription.billing.domain.CanonicalEventType;
import com.subscription.billing.domain.SubscriptionState;
import com.subscription.billing.domain.SubscriptionStatus;
import com.subscription.billing.domain.TransitionOutcome;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Applies canonical events to a subscription's state. Pure: no I/O, no clock.
 * <p>
 * Events older than the last applied provider event are stale. Events not covered by an explicit
 * transition are conflicts and leave the state untouched.
 */
@Component
public class SubscriptionStateMachine {

    private static final Set<SubscriptionStatus> ACTIVATABLE = EnumSet.of(
            SubscriptionStatus.CREATED,
            SubscriptionStatus.AUTHENTICATED,
            SubscriptionStatus.PAUSED,
            SubscriptionStatus.PENDING_CANCELLATION);

    private static final Set<SubscriptionStatus> CANCELLABLE_BEFORE_START = EnumSet.of(
            SubscriptionStatus.CREATED,
            SubscriptionStatus.AUTHENTICATED,
            SubscriptionStatus.PAUSED);

    public Transition apply(SubscriptionState current, CanonicalEvent event) {
        Objects.requireNonNull(current, "current state");
        Objects.requireNonNull(event, "event");

        if (isBehindWatermark(current, event)) {
            return unchanged(TransitionOutcome.STALE, current, event,
                    "event at " + event.getOccurredAt() + " is older than last applied event at " + current.getLastEventAt());
        }

        switch (event.getType()) {
            case CREATED:
                return onCreated(current, event);
            case AUTHENTICATED:
                return onAuthenticated(current, event);
            case ACTIVATED:
                return onActivated(current, event);
            case CHARGED:
                return onCharged(current, event);
            case CANCELLED:
                return onCancelled(current, event);
            case PAUSED:
                return onPaused(current, event);
            case RESUMED:
                return onResumed(current, event);
            case COMPLETED:
                return onCompleted(current, event);
            case PENDING:
                return unchanged(TransitionOutcome.NO_CHANGE, current, event, "recorded for audit");
            case UPDATED:
                return onUpdated(current, event);
            case EXPIRED:
                return onExpired(current, event);
            default:
                return conflict(current, event);
        }
    }

    private Transition onCreated(SubscriptionState current, CanonicalEvent event) {
        if (current.getStatus() == SubscriptionStatus.CREATED) {
            return unchanged(TransitionOutcome.NO_CHANGE, current, event, null);
        }
        return unchanged(TransitionOutcome.STALE, current, event, "subscription already past created");
    }

    private Transition onAuthenticated(SubscriptionState current, CanonicalEvent event) {
        SubscriptionStatus from = current.getStatus();
        if (from == SubscriptionStatus.CREATED) {
            return applied(current, event, current.toBuilder().status(SubscriptionStatus.AUTHENTICATED));
        }
        if (from == SubscriptionStatus.AUTHENTICATED) {
            return unchanged(TransitionOutcome.NO_CHANGE, current, event, null);
        }
        if (from.isTerminal()) {
            return conflict(current, event);
        }
        return unchanged(TransitionOutcome.STALE, current, event, "subscription already past authenticated");
    }

    private Transition onActivated(SubscriptionState current, CanonicalEvent event) {
        SubscriptionStatus from = current.getStatus();
        if (from == SubscriptionStatus.ACTIVE) {
            return unchanged(TransitionOutcome.NO_CHANGE, current, event, null);
        }
        if (!ACTIVATABLE.contains(from)) {
            return conflict(current, event);
        }
        SubscriptionState.SubscriptionStateBuilder next = withPeriod(current, event)
                .status(SubscriptionStatus.ACTIVE)
                .cancelAtCycleEnd(false)
                .cancellationReason(null)
                .cancelledAt(null);
        return applied(current, event, next);
    }

    private Transition onCharged(SubscriptionState current, CanonicalEvent event) {
        SubscriptionStatus from = current.getStatus();
        if (from != SubscriptionStatus.ACTIVE && !ACTIVATABLE.contains(from)) {
            return conflict(current, event);
        }
        if (event.getPeriodEnd() != null && current.getCurrentPeriodEnd() != null
                && event.getPeriodEnd().isBefore(current.getCurrentPeriodEnd())) {
            return unchanged(TransitionOutcome.STALE, current, event,
                    "charge for period ending " + event.getPeriodEnd() + " precedes current period end " + current.getCurrentPeriodEnd());
        }

        int paidCount = event.getPaidCount() != null
                ? Math.max(event.getPaidCount(), current.getPaidCount())
                : current.getPaidCount() + 1;
        Integer totalCount = event.getTotalCount() != null ? event.getTotalCount() : current.getTotalCount();
        Integer remainingCount = event.getRemainingCount() != null
                ? event.getRemainingCount()
                : (totalCount != null ? Math.max(0, totalCount - paidCount) : null);
        Instant periodEnd = event.getPeriodEnd() != null ? event.getPeriodEnd() : current.getCurrentPeriodEnd();

        SubscriptionState.SubscriptionStateBuilder next = current.toBuilder()
                .status(SubscriptionStatus.ACTIVE)
                .currentPeriodStart(event.getPeriodStart() != null ? event.getPeriodStart() : current.getCurrentPeriodStart())
                .currentPeriodEnd(periodEnd)
                .nextBillingAt(event.getNextBillingAt() != null ? event.getNextBillingAt() : periodEnd)
                .totalCount(totalCount)
                .paidCount(paidCount)
                .remainingCount(remainingCount);
        if (from != SubscriptionStatus.ACTIVE) {
            next.cancelAtCycleEnd(false).cancellationReason(null).cancelledAt(null);
        }
        if (event.getProviderPlanId() != null) {
            next.providerPlanId(event.getProviderPlanId());
        }
        return applied(current, event, next);
    }

    private Transition onCancelled(SubscriptionState current, CanonicalEvent event) {
        SubscriptionStatus from = current.getStatus();
        if (from == SubscriptionStatus.CANCELLED) {
            return unchanged(TransitionOutcome.NO_CHANGE, current, event, null);
        }
        if (from == SubscriptionStatus.EXPIRED) {
            return unchanged(TransitionOutcome.STALE, current, event, "subscription already expired");
        }
        if (from == SubscriptionStatus.COMPLETED) {
            return conflict(current, event);
        }

        boolean atCycleEnd = Boolean.TRUE.equals(event.getCancelAtCycleEnd());
        if (atCycleEnd && from == SubscriptionStatus.PENDING_CANCELLATION) {
            return unchanged(TransitionOutcome.NO_CHANGE, current, event, null);
        }
        if (atCycleEnd && from == SubscriptionStatus.ACTIVE) {
            return applied(current, event, current.toBuilder()
                    .status(SubscriptionStatus.PENDING_CANCELLATION)
                    .cancelAtCycleEnd(true)
                    .cancellationReason(reasonOrKeep(current, event))
                    .cancelledAt(event.getOccurredAt()));
        }
        if (atCycleEnd && !CANCELLABLE_BEFORE_START.contains(from)) {
            return conflict(current, event);
        }
        return applied(current, event, current.toBuilder()
                .status(SubscriptionStatus.CANCELLED)
                .cancelAtCycleEnd(false)
                .nextBillingAt(null)
                .cancellationReason(reasonOrKeep(current, event))
                .cancelledAt(current.getCancelledAt() != null && from == SubscriptionStatus.PENDING_CANCELLATION
                        ? current.getCancelledAt()
                        : event.getOccurredAt()));
    }

    private Transition onPaused(SubscriptionState current, CanonicalEvent event) {
        SubscriptionStatus from = current.getStatus();
        if (from == SubscriptionStatus.PAUSED) {
            return unchanged(TransitionOutcome.NO_CHANGE, current, event, null);
        }
        if (from != SubscriptionStatus.ACTIVE) {
            return conflict(current, event);
        }
        return applied(current, event, current.toBuilder()
                .status(SubscriptionStatus.PAUSED)
                .cancellationReason(event.getCancellationReason() != null ? event.getCancellationReason() : current.getCancellationReason()));
    }

    private Transition onResumed(SubscriptionState current, CanonicalEvent event) {
        SubscriptionStatus from = current.getStatus();
        if (from == SubscriptionStatus.ACTIVE) {
            return unchanged(TransitionOutcome.NO_CHANGE, current, event, null);
        }
        if (from != SubscriptionStatus.PAUSED) {
            return conflict(current, event);
        }
        return applied(current, event, withPeriod(current, event)
                .status(SubscriptionStatus.ACTIVE)
                .cancellationReason(null));
    }

    private Transition onCompleted(SubscriptionState current, CanonicalEvent event) {
        SubscriptionStatus from = current.getStatus();
        if (from == SubscriptionStatus.COMPLETED) {
            return unchanged(TransitionOutcome.NO_CHANGE, current, event, null);
        }
        if (from != SubscriptionStatus.ACTIVE) {
            return conflict(current, event);
        }
        return applied(current, event, current.toBuilder()
                .status(SubscriptionStatus.COMPLETED)
                .remainingCount(0)
                .nextBillingAt(null)
                .paidCount(event.getPaidCount() != null ? Math.max(event.getPaidCount(), current.getPaidCount()) : current.getPaidCount()));
    }

    private Transition onUpdated(SubscriptionState current, CanonicalEvent event) {
        SubscriptionState.SubscriptionStateBuilder next = withPeriod(current, event);
        if (event.getProviderPlanId() != null) {
            next.providerPlanId(event.getProviderPlanId());
        }
        if (event.getTotalCount() != null) {
            next.totalCount(event.getTotalCount());
        }
        if (event.getPaidCount() != null) {
            next.paidCount(Math.max(event.getPaidCount(), current.getPaidCount()));
        }
        if (event.getRemainingCount() != null) {
            next.remainingCount(event.getRemainingCount());
        }
        if (event.getCancelAtCycleEnd() != null) {
            next.cancelAtCycleEnd(event.getCancelAtCycleEnd());
        }

        String note = "metadata refreshed";
        SubscriptionStatus providerStatus = reportedStatus(current, event);
        if (providerStatus != null && providerStatus != current.getStatus()) {
            next.status(providerStatus);
            if (providerStatus == SubscriptionStatus.ACTIVE) {
                next.cancelAtCycleEnd(false);
            }
            if (providerStatus == SubscriptionStatus.CANCELLED && current.getCancelledAt() == null) {
                next.cancelledAt(event.getOccurredAt());
            }
            if (providerStatus == SubscriptionStatus.PENDING_CANCELLATION) {
                next.cancelAtCycleEnd(true);
            }
            note = "status corrected from " + current.getStatus().getToken() + " to provider status " + providerStatus.getToken();
        }

        SubscriptionState candidate = next.build();
        if (sameExceptWatermark(current, candidate)) {
            return unchanged(TransitionOutcome.NO_CHANGE, current, event, null);
        }
        return new Transition(TransitionOutcome.APPLIED, event.getType(), current.getStatus(),
                advanceWatermark(candidate, event), note);
    }

    /**
     * Razorpay reports {@code active} until the cycle ends, even with a cancellation scheduled.
     * That is only a resume when the event says the cancellation was withdrawn.
     */
    private static SubscriptionStatus reportedStatus(SubscriptionState current, CanonicalEvent event) {
        SubscriptionStatus reported = event.getProviderStatus();
        if (reported != SubscriptionStatus.ACTIVE) {
            return reported;
        }
        boolean scheduled = event.getCancelAtCycleEnd() != null
                ? event.getCancelAtCycleEnd()
                : current.getStatus() == SubscriptionStatus.PENDING_CANCELLATION;
        return scheduled ? SubscriptionStatus.PENDING_CANCELLATION : reported;
    }

    private Transition onExpired(SubscriptionState current, CanonicalEvent event) {
        SubscriptionStatus from = current.getStatus();
        if (from == SubscriptionStatus.EXPIRED) {
            return unchanged(TransitionOutcome.NO_CHANGE, current, event, null);
        }
        boolean providerReported = event.getProviderStatus() == SubscriptionStatus.EXPIRED;
        if (from == SubscriptionStatus.CANCELLED || from == SubscriptionStatus.COMPLETED || providerReported) {
            return applied(current, event, current.toBuilder()
                    .status(SubscriptionStatus.EXPIRED)
                    .cancelAtCycleEnd(false)
                    .nextBillingAt(null));
        }
        return conflict(current, event);
    }

    private static SubscriptionState.SubscriptionStateBuilder withPeriod(SubscriptionState current, CanonicalEvent event) {
        SubscriptionState.SubscriptionStateBuilder builder = current.toBuilder();
        if (event.getPeriodStart() != null) {
            builder.currentPeriodStart(event.getPeriodStart());
        }
        if (event.getPeriodEnd() != null) {
            builder.currentPeriodEnd(event.getPeriodEnd());
        }
        if (event.getNextBillingAt() != null) {
            builder.nextBillingAt(event.getNextBillingAt());
        }
        return builder;
    }

    private static String reasonOrKeep(SubscriptionState current, CanonicalEvent event) {
        return event.getCancellationReason() != null ? event.getCancellationReason() : current.getCancellationReason();
    }

    private static boolean isBehindWatermark(SubscriptionState current, CanonicalEvent event) {
        return event.getOccurredAt() != null && current.getLastEventAt() != null
                && event.getOccurredAt().isBefore(current.getLastEventAt());
    }

    private static boolean sameExceptWatermark(SubscriptionState a, SubscriptionState b) {
        return a.toBuilder().lastEventAt(null).build().equals(b.toBuilder().lastEventAt(null).build());
    }

    private static SubscriptionState advanceWatermark(SubscriptionState state, CanonicalEvent event) {
        Instant occurredAt = event.getOccurredAt();
        if (occurredAt == null || (state.getLastEventAt() != null && !occurredAt.isAfter(state.getLastEventAt()))) {
            return state;
        }
        return state.toBuilder().lastEventAt(occurredAt).build();
    }

    private static Transition applied(SubscriptionState current, CanonicalEvent event,
                                      SubscriptionState.SubscriptionStateBuilder next) {
        SubscriptionState nextState = advanceWatermark(next.build(), event);
        String note = current.getStatus() == nextState.getStatus()
                ? null
                : current.getStatus().getToken() + " -> " + nextState.getStatus().getToken();
        return new Transition(TransitionOutcome.APPLIED, event.getType(), current.getStatus(), nextState, note);
    }

    private static Transition unchanged(TransitionOutcome outcome, SubscriptionState current, CanonicalEvent event, String note) {
        return new Transition(outcome, event.getType(), current.getStatus(), current, note);
    }

    private static Transition conflict(SubscriptionState current, CanonicalEvent event) {
        CanonicalEventType type = event.getType();
        return unchanged(TransitionOutcome.CONFLICT, current, event,
                "event " + type.getToken() + " not allowed from " + current.getStatus().getToken());
    }
}
