package com.subscription.billing.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.subscription.billing.adapters.RazorpayAdapter;
import com.subscription.billing.canonical.EventCanonicalizer;
import com.subscription.billing.compliance.ComplianceAuditLogger;
import com.subscription.billing.core.exception.VerificationException;
import com.subscription.billing.domain.CanonicalEvent;
import com.subscription.billing.domain.CanonicalEventType;
import com.subscription.billing.domain.ProviderType;
import com.subscription.billing.domain.SubscriptionStatus;
import com.subscription.billing.domain.TransitionOutcome;
import com.subscription.billing.persistence.entity.SubscriptionEntity;
import com.subscription.billing.persistence.entity.WebhookEventEntity;
import com.subscription.billing.persistence.repository.SubscriptionRepository;
import com.subscription.billing.persistence.service.LedgerResult;
import com.subscription.billing.persistence.service.WebhookEventStore;
import com.subscription.billing.verification.AppleNotification;
import com.subscription.billing.verification.AppleSignedPayloadVerifier;
import com.subscription.billing.verification.WebhookSignatureVerifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WebhookReconciliationServiceTest {

    private static final String WEBHOOK_SECRET = "whsec_test";
    private static final String RAZORPAY_CHARGED = """
            {
              "event": "subscription.charged",
              "created_at": 1767225700,
              "payload": {
                "subscription": {"entity": {
                  "id": "sub_123", "status": "active", "plan_id": "plan_1",
                  "current_start": 1767225600, "current_end": 1769904000, "charge_at": 1769904000,
                  "total_count": 12, "paid_count": 1, "remaining_count": 11
                }},
                "payment": {"entity": {"id": "pay_1", "amount": 49900, "currency": "INR", "status": "captured", "method": "card", "created_at": 1767225650}}
              }
            }
            """;

    @Mock
    private ProviderRegistry providerRegistry;

    @Mock
    private AppleSignedPayloadVerifier appleVerifier;

    @Mock
    private WebhookEventStore webhookEventStore;

    @Mock
    private SubscriptionRepository subscriptionRepository;

    @Mock
    private SubscriptionEventRecorder recorder;

    @Mock
    private ReconciliationScheduler reconciliationScheduler;

    @Mock
    private ReceiptService receiptService;

    @Mock
    private ComplianceAuditLogger auditLogger;

    @Mock
    private SubscriptionProvider googlePlay;

    private WebhookReconciliationService service;
    private SubscriptionEntity subscription;

    @BeforeEach
    void setUp() {
        RazorpayAdapter razorpay = new RazorpayAdapter("rzp_key", "rzp_secret", WEBHOOK_SECRET,
                "https://api.razorpay.com/v1", new RestTemplate());
        lenient().when(providerRegistry.get(ProviderType.RAZORPAY)).thenReturn(razorpay);
        lenient().when(providerRegistry.get(ProviderType.GOOGLE_PLAY)).thenReturn(googlePlay);
        EventCanonicalizer canonicalizer = new EventCanonicalizer(new ObjectMapper(), "com.example.app", "com.example.app");
        service = new WebhookReconciliationService(providerRegistry, canonicalizer, appleVerifier, webhookEventStore,
                subscriptionRepository, recorder, reconciliationScheduler, receiptService, auditLogger);

        subscription = SubscriptionEntity.builder()
                .id(UUID.randomUUID())
                .userId("user-1")
                .provider(ProviderType.RAZORPAY)
                .providerSubscriptionId("sub_123")
                .status(SubscriptionStatus.ACTIVE)
                .build();
    }

    @Test
    void validRazorpayWebhookIsRecordedAndInboxSettled() {
        WebhookEventEntity inbox = inbox();
        when(webhookEventStore.register(eq(ProviderType.RAZORPAY), eq("evt_1"), eq("subscription.charged"), anyString()))
                .thenReturn(Optional.of(inbox));
        when(subscriptionRepository.findByProviderAndProviderSubscriptionId(ProviderType.RAZORPAY, "sub_123"))
                .thenReturn(Optional.of(subscription));
        when(recorder.record(eq(subscription.getId()), any(), eq("webhook:razorpay")))
                .thenReturn(ledgerResult(TransitionOutcome.APPLIED, SubscriptionStatus.ACTIVE));

        WebhookResult result = service.handleRazorpay(RAZORPAY_CHARGED, sign(RAZORPAY_CHARGED), "evt_1");

        assertThat(result.getStatus()).isEqualTo(WebhookResult.Status.PROCESSED);
        assertThat(result.getOutcome()).isEqualTo(TransitionOutcome.APPLIED);
        ArgumentCaptor<CanonicalEvent> captor = ArgumentCaptor.forClass(CanonicalEvent.class);
        verify(recorder).record(eq(subscription.getId()), captor.capture(), eq("webhook:razorpay"));
        assertThat(captor.getValue().getType()).isEqualTo(CanonicalEventType.CHARGED);
        assertThat(captor.getValue().getPayment().getPaymentId()).isEqualTo("pay_1");
        verify(webhookEventStore).markProcessed(inbox.getId(), subscription.getId());
        verifyNoInteractions(reconciliationScheduler);
    }

    @Test
    void sameWebhookDeliveredTwiceIsRecordedOnce() {
        WebhookEventEntity inbox = inbox();
        when(webhookEventStore.register(eq(ProviderType.RAZORPAY), eq("evt_1"), any(), anyString()))
                .thenReturn(Optional.of(inbox))
                .thenReturn(Optional.empty());
        when(subscriptionRepository.findByProviderAndProviderSubscriptionId(ProviderType.RAZORPAY, "sub_123"))
                .thenReturn(Optional.of(subscription));
        when(recorder.record(any(), any(), any())).thenReturn(ledgerResult(TransitionOutcome.APPLIED, SubscriptionStatus.ACTIVE));

        WebhookResult first = service.handleRazorpay(RAZORPAY_CHARGED, sign(RAZORPAY_CHARGED), "evt_1");
        WebhookResult second = service.handleRazorpay(RAZORPAY_CHARGED, sign(RAZORPAY_CHARGED), "evt_1");

        assertThat(first.getStatus()).isEqualTo(WebhookResult.Status.PROCESSED);
        assertThat(second.getStatus()).isEqualTo(WebhookResult.Status.DUPLICATE);
        verify(recorder, times(1)).record(any(), any(), any());
    }

    @Test
    void tamperedSignatureIsRejectedWithoutSideEffects() {
        String tampered = RAZORPAY_CHARGED.replace("49900", "1");

        assertThatThrownBy(() -> service.handleRazorpay(tampered, sign(RAZORPAY_CHARGED), "evt_1"))
                .isInstanceOf(VerificationException.class)
                .extracting("code").isEqualTo("INVALID_SIGNATURE");

        verify(auditLogger).logVerificationRejected(eq(ProviderType.RAZORPAY), any(), any());
        verifyNoInteractions(webhookEventStore, subscriptionRepository, recorder, reconciliationScheduler);
    }

    @Test
    void missingSignatureIsRejected() {
        assertThatThrownBy(() -> service.handleRazorpay(RAZORPAY_CHARGED, null, "evt_1"))
                .isInstanceOf(VerificationException.class);
        verifyNoInteractions(recorder);
    }

    @Test
    void unknownSubscriptionIsMarkedFailedAndAcknowledged() {
        WebhookEventEntity inbox = inbox();
        when(webhookEventStore.register(any(), any(), any(), anyString())).thenReturn(Optional.of(inbox));
        when(subscriptionRepository.findByProviderAndProviderSubscriptionId(ProviderType.RAZORPAY, "sub_123"))
                .thenReturn(Optional.empty());

        WebhookResult result = service.handleRazorpay(RAZORPAY_CHARGED, sign(RAZORPAY_CHARGED), "evt_1");

        assertThat(result.getStatus()).isEqualTo(WebhookResult.Status.UNKNOWN_SUBSCRIPTION);
        verify(webhookEventStore).markFailed(eq(inbox.getId()), isNull(), eq("subscription not found"));
        verifyNoInteractions(recorder);
    }

    @Test
    void unmappedRazorpayEventIsIgnored() {
        String body = "{\"event\":\"payment.authorized\",\"payload\":{}}";
        WebhookEventEntity inbox = inbox();
        when(webhookEventStore.register(any(), any(), eq("unmapped"), anyString())).thenReturn(Optional.of(inbox));

        WebhookResult result = service.handleRazorpay(body, sign(body), null);

        assertThat(result.getStatus()).isEqualTo(WebhookResult.Status.IGNORED);
        verify(webhookEventStore).markIgnored(eq(inbox.getId()), any());
    }

    @Test
    void conflictSchedulesReconciliation() {
        WebhookEventEntity inbox = inbox();
        when(webhookEventStore.register(any(), any(), any(), anyString())).thenReturn(Optional.of(inbox));
        when(subscriptionRepository.findByProviderAndProviderSubscriptionId(ProviderType.RAZORPAY, "sub_123"))
                .thenReturn(Optional.of(subscription));
        when(recorder.record(any(), any(), any())).thenReturn(ledgerResult(TransitionOutcome.CONFLICT, SubscriptionStatus.ACTIVE));

        service.handleRazorpay(RAZORPAY_CHARGED, sign(RAZORPAY_CHARGED), "evt_1");

        ArgumentCaptor<ReconciliationTask> task = ArgumentCaptor.forClass(ReconciliationTask.class);
        verify(reconciliationScheduler).schedule(task.capture());
        assertThat(task.getValue().getSubscriptionId()).isEqualTo(subscription.getId());
        assertThat(task.getValue().getPendingEvent()).isNull();
        verify(webhookEventStore).markProcessed(inbox.getId(), subscription.getId());
    }

    @Test
    void googlePlayRenewalIsDeferredToProviderFetch() {
        when(googlePlay.verifyWebhookSignature(anyString(), eq("push-token"))).thenReturn(true);
        SubscriptionEntity playSub = SubscriptionEntity.builder()
                .id(UUID.randomUUID())
                .userId("user-1")
                .provider(ProviderType.GOOGLE_PLAY)
                .providerSubscriptionId("tok-1")
                .status(SubscriptionStatus.ACTIVE)
                .build();
        WebhookEventEntity inbox = inbox();
        when(webhookEventStore.register(eq(ProviderType.GOOGLE_PLAY), eq("msg-1"), eq("SUBSCRIPTION_RENEWED"), anyString()))
                .thenReturn(Optional.of(inbox));
        when(subscriptionRepository.findByProviderAndProviderSubscriptionId(ProviderType.GOOGLE_PLAY, "tok-1"))
                .thenReturn(Optional.of(playSub));

        String rtdn = "{\"version\":\"1.0\",\"packageName\":\"com.example.app\",\"eventTimeMillis\":\"1767225600000\","
                + "\"subscriptionNotification\":{\"version\":\"1.0\",\"notificationType\":2,\"purchaseToken\":\"tok-1\",\"subscriptionId\":\"premium_monthly\"}}";
        WebhookResult result = service.handleGooglePlay(pubSub(rtdn, "msg-1"), "push-token");

        assertThat(result.getStatus()).isEqualTo(WebhookResult.Status.DEFERRED);
        ArgumentCaptor<ReconciliationTask> task = ArgumentCaptor.forClass(ReconciliationTask.class);
        verify(reconciliationScheduler).schedule(task.capture());
        assertThat(task.getValue().getWebhookEventId()).isEqualTo(inbox.getId());
        assertThat(task.getValue().getPendingEvent().getType()).isEqualTo(CanonicalEventType.CHARGED);
        verifyNoInteractions(recorder);
        verify(webhookEventStore, never()).markProcessed(any(), any());
    }

    @Test
    void googlePlayWrongPushTokenIsRejected() {
        when(googlePlay.verifyWebhookSignature(anyString(), eq("wrong"))).thenReturn(false);

        assertThatThrownBy(() -> service.handleGooglePlay(pubSub("{}", "msg-1"), "wrong"))
                .isInstanceOf(VerificationException.class);
        verifyNoInteractions(webhookEventStore);
    }

    @Test
    void appleRevocationMarksReceiptRefunded() {
        String body = "{\"signedPayload\":\"eyJ...\"}";
        Map<String, Object> notification = Map.of(
                "notificationType", "REVOKE",
                "notificationUUID", "b6a1c2d3-0000-4000-8000-000000000001",
                "signedDate", 1772000000000L,
                "data", Map.of("bundleId", "com.example.app", "environment", "Production"));
        Map<String, Object> transaction = Map.of(
                "originalTransactionId", "1000000001",
                "transactionId", "1000000003",
                "productId", "premium_monthly",
                "expiresDate", 1774000000000L);
        when(appleVerifier.verifyNotification(body)).thenReturn(new AppleNotification(notification, transaction));
        when(webhookEventStore.register(eq(ProviderType.APPLE_APPSTORE), eq("b6a1c2d3-0000-4000-8000-000000000001"), any(), anyString()))
                .thenReturn(Optional.of(inbox()));
        subscription.setProvider(ProviderType.APPLE_APPSTORE);
        subscription.setProviderSubscriptionId("1000000001");
        when(subscriptionRepository.findByProviderAndProviderSubscriptionId(ProviderType.APPLE_APPSTORE, "1000000001"))
                .thenReturn(Optional.of(subscription));
        when(recorder.record(eq(subscription.getId()), any(), eq("webhook:apple_appstore")))
                .thenReturn(ledgerResult(TransitionOutcome.APPLIED, SubscriptionStatus.CANCELLED));

        WebhookResult result = service.handleApple(body);

        assertThat(result.getStatus()).isEqualTo(WebhookResult.Status.PROCESSED);
        ArgumentCaptor<CanonicalEvent> captor = ArgumentCaptor.forClass(CanonicalEvent.class);
        verify(recorder).record(eq(subscription.getId()), captor.capture(), eq("webhook:apple_appstore"));
        assertThat(captor.getValue().getType()).isEqualTo(CanonicalEventType.CANCELLED);
        assertThat(captor.getValue().getCancellationReason()).isEqualTo("revoked");
        verify(receiptService).markRefunded(ProviderType.APPLE_APPSTORE, "1000000001");
    }

    @Test
    void appleRejectionIsAuditedAndRethrown() {
        when(appleVerifier.verifyNotification("{\"signedPayload\":\"x\"}"))
                .thenThrow(new VerificationException("bad chain", "APPLE_JWS_INVALID", ProviderType.APPLE_APPSTORE, 401));

        assertThatThrownBy(() -> service.handleApple("{\"signedPayload\":\"x\"}"))
                .isInstanceOf(VerificationException.class);
        verify(auditLogger).logVerificationRejected(eq(ProviderType.APPLE_APPSTORE), any(), any());
        verifyNoInteractions(webhookEventStore);
    }

    private static WebhookEventEntity inbox() {
        return WebhookEventEntity.builder().id(UUID.randomUUID()).build();
    }

    private LedgerResult ledgerResult(TransitionOutcome outcome, SubscriptionStatus status) {
        return LedgerResult.builder()
                .subscriptionId(subscription.getId())
                .provider(subscription.getProvider())
                .outcome(outcome)
                .previousStatus(SubscriptionStatus.ACTIVE)
                .newStatus(status)
                .build();
    }

    private static String sign(String body) {
        return WebhookSignatureVerifier.hmacSha256Hex(body, WEBHOOK_SECRET);
    }

    private static String pubSub(String notificationJson, String messageId) {
        String data = Base64.getEncoder().encodeToString(notificationJson.getBytes(StandardCharsets.UTF_8));
        return "{\"message\":{\"data\":\"" + data + "\",\"messageId\":\"" + messageId + "\"},\"subscription\":\"projects/p/subscriptions/s\"}";
    }
}
