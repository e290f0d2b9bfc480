package com.subscription.billing.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.subscription.billing.canonical.EventCanonicalizer;
import com.subscription.billing.compliance.ComplianceAuditLogger;
import com.subscription.billing.core.exception.MethodNotSupportedException;
import com.subscription.billing.core.exception.ProviderFetchException;
import com.subscription.billing.domain.CanonicalEvent;
import com.subscription.billing.domain.CanonicalEventType;
import com.subscription.billing.domain.ProviderSubscriptionDetails;
import com.subscription.billing.domain.ProviderType;
import com.subscription.billing.domain.SubscriptionStatus;
import com.subscription.billing.domain.TransitionOutcome;
import com.subscription.billing.persistence.service.LedgerResult;
import com.subscription.billing.persistence.service.WebhookEventStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReconciliationSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private ResilientProviderCaller providerCaller;

    @Mock
    private SubscriptionEventRecorder recorder;

    @Mock
    private WebhookEventStore webhookEventStore;

    @Mock
    private ComplianceAuditLogger auditLogger;

    private ReconciliationScheduler scheduler;
    private final UUID subscriptionId = UUID.randomUUID();
    private final UUID webhookEventId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        EventCanonicalizer canonicalizer = new EventCanonicalizer(new ObjectMapper(), "", "");
        scheduler = new ReconciliationScheduler(providerCaller, canonicalizer, recorder, webhookEventStore, auditLogger,
                Clock.fixed(NOW, ZoneOffset.UTC), 1);
        ReflectionTestUtils.setField(scheduler, "maxRetries", 2);
        ReflectionTestUtils.setField(scheduler, "retryDelayMs", 10_000L);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void deferredRenewalIsCompletedWithFetchedPeriod() {
        Instant periodEnd = NOW.plus(Duration.ofDays(30));
        when(providerCaller.call(eq(ProviderType.GOOGLE_PLAY), eq("fetchSubscription"), any()))
                .thenReturn(ProviderCallResult.success(details(periodEnd)));
        when(recorder.record(eq(subscriptionId), any(), anyString()))
                .thenReturn(LedgerResult.builder().outcome(TransitionOutcome.APPLIED).newStatus(SubscriptionStatus.ACTIVE).build());
        CanonicalEvent renewal = CanonicalEvent.builder()
                .provider(ProviderType.GOOGLE_PLAY)
                .type(CanonicalEventType.CHARGED)
                .providerSubscriptionId("tok-1")
                .providerEventId("msg-1")
                .requiresProviderFetch(true)
                .build();

        scheduler.runAttempt(task(renewal), 0);

        ArgumentCaptor<CanonicalEvent> event = ArgumentCaptor.forClass(CanonicalEvent.class);
        verify(recorder).record(eq(subscriptionId), event.capture(), anyString());
        assertThat(event.getValue().getType()).isEqualTo(CanonicalEventType.CHARGED);
        assertThat(event.getValue().getPeriodEnd()).isEqualTo(periodEnd);
        assertThat(event.getValue().getProviderEventId()).isEqualTo("msg-1");
        assertThat(event.getValue().isRequiresProviderFetch()).isFalse();
        verify(webhookEventStore).markProcessed(webhookEventId, subscriptionId);
    }

    @Test
    void plainReconciliationRecordsProviderTruthAsUpdate() {
        when(providerCaller.call(eq(ProviderType.GOOGLE_PLAY), eq("fetchSubscription"), any()))
                .thenReturn(ProviderCallResult.success(details(NOW.plus(Duration.ofDays(30)))));
        when(recorder.record(eq(subscriptionId), any(), anyString()))
                .thenReturn(LedgerResult.builder().outcome(TransitionOutcome.NO_CHANGE).build());

        scheduler.runAttempt(ReconciliationTask.builder()
                .provider(ProviderType.GOOGLE_PLAY)
                .subscriptionId(subscriptionId)
                .providerSubscriptionId("tok-1")
                .reason("conflict:activated")
                .build(), 0);

        ArgumentCaptor<CanonicalEvent> event = ArgumentCaptor.forClass(CanonicalEvent.class);
        verify(recorder).record(eq(subscriptionId), event.capture(), anyString());
        assertThat(event.getValue().getType()).isEqualTo(CanonicalEventType.UPDATED);
        assertThat(event.getValue().getProviderStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
        verify(webhookEventStore, never()).markProcessed(any(), any());
    }

    @Test
    void permanentFailureIsDeadLetteredImmediately() {
        when(providerCaller.call(eq(ProviderType.GOOGLE_PLAY), eq("fetchSubscription"), any()))
                .thenReturn(ProviderCallResult.failure(new MethodNotSupportedException(ProviderType.GOOGLE_PLAY, "fetchSubscription")));

        scheduler.runAttempt(task(null), 0);

        verify(auditLogger).logDeadLetter(eq(ProviderType.GOOGLE_PLAY), eq(subscriptionId), anyString(), eq(1));
        verify(webhookEventStore).markFailed(eq(webhookEventId), eq(subscriptionId), anyString());
    }

    @Test
    void transientFailureOnLastAttemptIsDeadLettered() {
        when(providerCaller.call(eq(ProviderType.GOOGLE_PLAY), eq("fetchSubscription"), any()))
                .thenReturn(ProviderCallResult.failure(new ProviderFetchException("unavailable", "GOOGLE_PLAY_FETCH_FAILED",
                        ProviderType.GOOGLE_PLAY, 503)));

        scheduler.runAttempt(task(null), 2);

        verify(auditLogger).logDeadLetter(eq(ProviderType.GOOGLE_PLAY), eq(subscriptionId), anyString(), eq(3));
        verify(webhookEventStore).markFailed(eq(webhookEventId), eq(subscriptionId), anyString());
    }

    @Test
    void transientFailureBeforeLastAttemptIsRetriedLater() {
        when(providerCaller.call(eq(ProviderType.GOOGLE_PLAY), eq("fetchSubscription"), any()))
                .thenReturn(ProviderCallResult.failure(new ProviderFetchException("unavailable", "GOOGLE_PLAY_FETCH_FAILED",
                        ProviderType.GOOGLE_PLAY, 503)));

        scheduler.runAttempt(task(null), 0);

        verify(auditLogger, never()).logDeadLetter(any(), any(), anyString(), anyInt());
        verify(webhookEventStore, never()).markFailed(any(), any(), any());
    }

    private ReconciliationTask task(CanonicalEvent pending) {
        return ReconciliationTask.builder()
                .provider(ProviderType.GOOGLE_PLAY)
                .subscriptionId(subscriptionId)
                .providerSubscriptionId("tok-1")
                .webhookEventId(webhookEventId)
                .pendingEvent(pending)
                .reason("SUBSCRIPTION_RENEWED")
                .build();
    }

    private static ProviderSubscriptionDetails details(Instant periodEnd) {
        return ProviderSubscriptionDetails.builder()
                .provider(ProviderType.GOOGLE_PLAY)
                .providerSubscriptionId("tok-1")
                .status(SubscriptionStatus.ACTIVE)
                .planId("premium_monthly")
                .currentPeriodStart(periodEnd.minus(Duration.ofDays(30)))
                .currentPeriodEnd(periodEnd)
                .nextBillingAt(periodEnd)
                .autoRenewing(true)
                .build();
    }
}
