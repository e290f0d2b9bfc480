package com.subscription.billing.core;

import com.subscription.billing.core.exception.StateConflictException;
import com.subscription.billing.domain.CanonicalEvent;
import com.subscription.billing.domain.CanonicalEventType;
import com.subscription.billing.domain.ProviderType;
import com.subscription.billing.domain.SubscriptionState;
import com.subscription.billing.domain.SubscriptionStatus;
import com.subscription.billing.domain.TransitionOutcome;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubscriptionStateMachineTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    private static final Instant T30 = T0.plus(Duration.ofDays(30));

    private final SubscriptionStateMachine stateMachine = new SubscriptionStateMachine();

    @Test
    void fullRazorpayLifecycleAdvancesPaidCountAndNextBilling() {
        SubscriptionState state = state(SubscriptionStatus.CREATED).build();

        Transition authenticated = stateMachine.apply(state, event(CanonicalEventType.AUTHENTICATED, T0.minusSeconds(60)).build());
        assertThat(authenticated.getOutcome()).isEqualTo(TransitionOutcome.APPLIED);
        assertThat(authenticated.getNewStatus()).isEqualTo(SubscriptionStatus.AUTHENTICATED);

        Transition activated = stateMachine.apply(authenticated.getState(), event(CanonicalEventType.ACTIVATED, T0)
                .periodStart(T0).periodEnd(T30).paidCount(0).build());
        assertThat(activated.getNewStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
        assertThat(activated.getState().getPaidCount()).isZero();

        Transition charged = stateMachine.apply(activated.getState(), event(CanonicalEventType.CHARGED, T0.plusSeconds(5))
                .periodStart(T0).periodEnd(T30).build());
        assertThat(charged.getOutcome()).isEqualTo(TransitionOutcome.APPLIED);
        assertThat(charged.getState().getPaidCount()).isEqualTo(1);
        assertThat(charged.getState().getNextBillingAt()).isEqualTo(T30);
        assertThat(charged.getState().getCurrentPeriodEnd()).isEqualTo(T30);
    }

    @Test
    void chargeForEarlierPeriodIsStaleAndLeavesStateUntouched() {
        SubscriptionState active = state(SubscriptionStatus.ACTIVE)
                .currentPeriodStart(T30).currentPeriodEnd(T30.plus(Duration.ofDays(30))).paidCount(2).build();

        Transition t = stateMachine.apply(active, event(CanonicalEventType.CHARGED, T30.plusSeconds(10))
                .periodStart(T0).periodEnd(T30).build());

        assertThat(t.getOutcome()).isEqualTo(TransitionOutcome.STALE);
        assertThat(t.getState()).isEqualTo(active);
        assertThat(t.isApplied()).isFalse();
    }

    @Test
    void cycleEndCancelOnActiveKeepsAccessUntilPeriodEnd() {
        SubscriptionState active = state(SubscriptionStatus.ACTIVE).currentPeriodEnd(T30).nextBillingAt(T30).build();

        Transition t = stateMachine.apply(active, event(CanonicalEventType.CANCELLED, T0.plusSeconds(1))
                .cancelAtCycleEnd(true).cancellationReason("user_requested").build());

        assertThat(t.getNewStatus()).isEqualTo(SubscriptionStatus.PENDING_CANCELLATION);
        assertThat(t.getState().isCancelAtCycleEnd()).isTrue();
        assertThat(t.getState().getCurrentPeriodEnd()).isEqualTo(T30);
        assertThat(t.getNewStatus().grantsAccess()).isTrue();
    }

    @Test
    void immediateCancelFromPendingCancellationEndsSubscription() {
        SubscriptionState pending = state(SubscriptionStatus.PENDING_CANCELLATION)
                .cancelAtCycleEnd(true).cancelledAt(T0).currentPeriodEnd(T30).build();

        Transition t = stateMachine.apply(pending, event(CanonicalEventType.CANCELLED, T30).cancelAtCycleEnd(false).build());

        assertThat(t.getNewStatus()).isEqualTo(SubscriptionStatus.CANCELLED);
        assertThat(t.getState().getCancelledAt()).isEqualTo(T0);
    }

    @Test
    void repeatedCancelIsNoChange() {
        SubscriptionState cancelled = state(SubscriptionStatus.CANCELLED).build();

        Transition t = stateMachine.apply(cancelled, event(CanonicalEventType.CANCELLED, T30).build());

        assertThat(t.getOutcome()).isEqualTo(TransitionOutcome.NO_CHANGE);
    }

    @Test
    void activationOfCompletedSubscriptionIsConflict() {
        SubscriptionState completed = state(SubscriptionStatus.COMPLETED).build();

        Transition t = stateMachine.apply(completed, event(CanonicalEventType.ACTIVATED, T30).build());

        assertThat(t.getOutcome()).isEqualTo(TransitionOutcome.CONFLICT);
        assertThatThrownBy(t::orThrow).isInstanceOf(StateConflictException.class);
    }

    @Test
    void eventOlderThanWatermarkIsStale() {
        SubscriptionState active = state(SubscriptionStatus.ACTIVE).lastEventAt(T30).build();

        Transition t = stateMachine.apply(active, event(CanonicalEventType.PAUSED, T0).build());

        assertThat(t.getOutcome()).isEqualTo(TransitionOutcome.STALE);
        assertThat(t.getNewStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
    }

    @Test
    void pauseAndResumeRoundTrip() {
        SubscriptionState active = state(SubscriptionStatus.ACTIVE).build();

        Transition paused = stateMachine.apply(active, event(CanonicalEventType.PAUSED, T0.plusSeconds(1)).build());
        Transition resumed = stateMachine.apply(paused.getState(), event(CanonicalEventType.RESUMED, T0.plusSeconds(2)).build());

        assertThat(paused.getNewStatus()).isEqualTo(SubscriptionStatus.PAUSED);
        assertThat(resumed.getNewStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
        assertThat(resumed.getState().getLastEventAt()).isEqualTo(T0.plusSeconds(2));
    }

    @Test
    void updatedWithProviderStatusCorrectsLocalStatus() {
        SubscriptionState active = state(SubscriptionStatus.ACTIVE).build();

        Transition t = stateMachine.apply(active, event(CanonicalEventType.UPDATED, T0.plusSeconds(1))
                .providerStatus(SubscriptionStatus.CANCELLED).build());

        assertThat(t.getOutcome()).isEqualTo(TransitionOutcome.APPLIED);
        assertThat(t.getNewStatus()).isEqualTo(SubscriptionStatus.CANCELLED);
        assertThat(t.getState().getCancelledAt()).isEqualTo(T0.plusSeconds(1));
    }

    @Test
    void updatedWithNothingNewIsNoChange() {
        SubscriptionState active = state(SubscriptionStatus.ACTIVE).currentPeriodEnd(T30).build();

        Transition t = stateMachine.apply(active, event(CanonicalEventType.UPDATED, T0.plusSeconds(1))
                .providerStatus(SubscriptionStatus.ACTIVE).periodEnd(T30).build());

        assertThat(t.getOutcome()).isEqualTo(TransitionOutcome.NO_CHANGE);
    }

    @Test
    void providerStillActiveKeepsScheduledCycleEndCancellation() {
        SubscriptionState pending = state(SubscriptionStatus.PENDING_CANCELLATION)
                .cancelAtCycleEnd(true).currentPeriodStart(T0).currentPeriodEnd(T30).build();

        Transition t = stateMachine.apply(pending, event(CanonicalEventType.UPDATED, T0.plusSeconds(1))
                .providerStatus(SubscriptionStatus.ACTIVE).periodStart(T0).periodEnd(T30).build());

        assertThat(t.getOutcome()).isEqualTo(TransitionOutcome.NO_CHANGE);
        assertThat(t.getNewStatus()).isEqualTo(SubscriptionStatus.PENDING_CANCELLATION);
        assertThat(t.getState().isCancelAtCycleEnd()).isTrue();
    }

    @Test
    void providerStillActiveWithNewPeriodRefreshesPendingCancellation() {
        SubscriptionState pending = state(SubscriptionStatus.PENDING_CANCELLATION)
                .cancelAtCycleEnd(true).currentPeriodStart(T0).currentPeriodEnd(T30).build();
        Instant later = T30.plus(Duration.ofDays(1));

        Transition t = stateMachine.apply(pending, event(CanonicalEventType.UPDATED, T0.plusSeconds(1))
                .providerStatus(SubscriptionStatus.ACTIVE).periodEnd(later).build());

        assertThat(t.getOutcome()).isEqualTo(TransitionOutcome.APPLIED);
        assertThat(t.getNewStatus()).isEqualTo(SubscriptionStatus.PENDING_CANCELLATION);
        assertThat(t.getState().isCancelAtCycleEnd()).isTrue();
        assertThat(t.getState().getCurrentPeriodEnd()).isEqualTo(later);
    }

    @Test
    void withdrawnCycleEndCancellationReturnsToActive() {
        SubscriptionState pending = state(SubscriptionStatus.PENDING_CANCELLATION)
                .cancelAtCycleEnd(true).currentPeriodEnd(T30).build();

        Transition t = stateMachine.apply(pending, event(CanonicalEventType.UPDATED, T0.plusSeconds(1))
                .providerStatus(SubscriptionStatus.ACTIVE).cancelAtCycleEnd(false).build());

        assertThat(t.getNewStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
        assertThat(t.getState().isCancelAtCycleEnd()).isFalse();
    }

    @Test
    void expiryRequiresEndedSubscriptionUnlessProviderReportsIt() {
        SubscriptionState active = state(SubscriptionStatus.ACTIVE).build();

        assertThat(stateMachine.apply(active, event(CanonicalEventType.EXPIRED, T0.plusSeconds(1)).build()).getOutcome())
                .isEqualTo(TransitionOutcome.CONFLICT);
        assertThat(stateMachine.apply(active, event(CanonicalEventType.EXPIRED, T0.plusSeconds(1))
                .providerStatus(SubscriptionStatus.EXPIRED).build()).getNewStatus())
                .isEqualTo(SubscriptionStatus.EXPIRED);
        assertThat(stateMachine.apply(state(SubscriptionStatus.CANCELLED).build(),
                event(CanonicalEventType.EXPIRED, T0.plusSeconds(1)).build()).getNewStatus())
                .isEqualTo(SubscriptionStatus.EXPIRED);
    }

    @Test
    void pendingIsRecordedWithoutChange() {
        SubscriptionState active = state(SubscriptionStatus.ACTIVE).build();

        Transition t = stateMachine.apply(active, event(CanonicalEventType.PENDING, T0.plusSeconds(1)).build());

        assertThat(t.getOutcome()).isEqualTo(TransitionOutcome.NO_CHANGE);
        assertThat(t.getState().getLastEventAt()).isEqualTo(T0.minusSeconds(3600));
    }

    private static SubscriptionState.SubscriptionStateBuilder state(SubscriptionStatus status) {
        return SubscriptionState.builder().status(status).lastEventAt(T0.minusSeconds(3600));
    }

    private static CanonicalEvent.CanonicalEventBuilder event(CanonicalEventType type, Instant occurredAt) {
        return CanonicalEvent.builder()
                .provider(ProviderType.RAZORPAY)
                .type(type)
                .providerSubscriptionId("sub_1")
                .occurredAt(occurredAt);
    }
}
