package com.subscription.billing.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.subscription.billing.canonical.EventCanonicalizer;
import com.subscription.billing.compliance.ComplianceAuditLogger;
import com.subscription.billing.core.exception.VerificationException;
import com.subscription.billing.domain.CanonicalEvent;
import com.subscription.billing.domain.CanonicalEventType;
import com.subscription.billing.domain.ProviderType;
import com.subscription.billing.domain.ReceiptPlatform;
import com.subscription.billing.domain.ReceiptValidationResult;
import com.subscription.billing.domain.ReceiptValidationStatus;
import com.subscription.billing.domain.SubscriptionStatus;
import com.subscription.billing.domain.TransitionOutcome;
import com.subscription.billing.persistence.entity.IapReceiptEntity;
import com.subscription.billing.persistence.entity.SubscriptionEntity;
import com.subscription.billing.persistence.repository.IapReceiptRepository;
import com.subscription.billing.persistence.repository.SubscriptionRepository;
import com.subscription.billing.persistence.service.LedgerResult;
import com.subscription.billing.persistence.service.SubscriptionLedgerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReceiptServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String RECEIPT = "premium_monthly:tok-1";

    @Mock
    private ResilientProviderCaller providerCaller;

    @Mock
    private IapReceiptRepository receiptRepository;

    @Mock
    private SubscriptionRepository subscriptionRepository;

    @Mock
    private SubscriptionLedgerService ledgerService;

    @Mock
    private SubscriptionEventRecorder recorder;

    @Mock
    private ComplianceAuditLogger auditLogger;

    private ReceiptService service;

    @BeforeEach
    void setUp() {
        EventCanonicalizer canonicalizer = new EventCanonicalizer(new ObjectMapper(), "com.example.app", "");
        service = new ReceiptService(providerCaller, canonicalizer, receiptRepository, subscriptionRepository,
                ledgerService, recorder, auditLogger, Clock.fixed(NOW, ZoneOffset.UTC));
        lenient().when(receiptRepository.save(any(IapReceiptEntity.class))).thenAnswer(inv -> inv.getArgument(0));
        lenient().when(receiptRepository.findByProviderAndTransactionId(any(), any())).thenReturn(Optional.empty());
    }

    @Test
    void firstValidReceiptCreatesActiveSubscription() {
        stubValidation(validResult(NOW.plus(Duration.ofDays(30))));
        when(subscriptionRepository.findByProviderAndProviderSubscriptionId(ProviderType.GOOGLE_PLAY, "tok-1"))
                .thenReturn(Optional.empty());
        UUID newId = UUID.randomUUID();
        when(ledgerService.createSubscription(any(), any())).thenReturn(LedgerResult.builder()
                .subscriptionId(newId).outcome(TransitionOutcome.APPLIED).newStatus(SubscriptionStatus.ACTIVE).build());

        ReceiptValidationOutcome outcome = service.validateReceipt("user-1", RECEIPT, ReceiptPlatform.ANDROID);

        ArgumentCaptor<SubscriptionEntity> entity = ArgumentCaptor.forClass(SubscriptionEntity.class);
        ArgumentCaptor<CanonicalEvent> event = ArgumentCaptor.forClass(CanonicalEvent.class);
        verify(ledgerService).createSubscription(entity.capture(), event.capture());
        assertThat(entity.getValue().getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
        assertThat(entity.getValue().getUserId()).isEqualTo("user-1");
        assertThat(event.getValue().getType()).isEqualTo(CanonicalEventType.ACTIVATED);
        assertThat(outcome.isCreated()).isTrue();
        assertThat(outcome.getValidation().isValid()).isTrue();
    }

    @Test
    void invalidReceiptWithoutSubscriptionCreatesNothing() {
        stubValidation(ReceiptValidationResult.builder()
                .provider(ProviderType.GOOGLE_PLAY).valid(false).status(SubscriptionStatus.EXPIRED)
                .providerSubscriptionId("tok-1").productId("premium_monthly")
                .expiryDate(NOW.minus(Duration.ofDays(1))).build());
        when(subscriptionRepository.findByProviderAndProviderSubscriptionId(ProviderType.GOOGLE_PLAY, "tok-1"))
                .thenReturn(Optional.empty());

        ReceiptValidationOutcome outcome = service.validateReceipt("user-1", RECEIPT, ReceiptPlatform.ANDROID);

        assertThat(outcome.getSubscription()).isNull();
        verify(ledgerService, never()).createSubscription(any(), any());
        ArgumentCaptor<IapReceiptEntity> row = ArgumentCaptor.forClass(IapReceiptEntity.class);
        verify(receiptRepository).save(row.capture());
        assertThat(row.getValue().getValidationStatus()).isEqualTo(ReceiptValidationStatus.INVALID);
    }

    @Test
    void laterReceiptWithNewExpiryIsCharged() {
        SubscriptionEntity existing = existing(SubscriptionStatus.ACTIVE, NOW.plus(Duration.ofDays(2)));
        stubValidation(validResult(NOW.plus(Duration.ofDays(32))));
        when(subscriptionRepository.findByProviderAndProviderSubscriptionId(ProviderType.GOOGLE_PLAY, "tok-1"))
                .thenReturn(Optional.of(existing));
        when(recorder.record(eq(existing.getId()), any(), eq("receipt:android")))
                .thenReturn(LedgerResult.builder().outcome(TransitionOutcome.APPLIED).build());

        service.validateReceipt("user-1", RECEIPT, ReceiptPlatform.ANDROID);

        ArgumentCaptor<CanonicalEvent> event = ArgumentCaptor.forClass(CanonicalEvent.class);
        verify(recorder).record(eq(existing.getId()), event.capture(), eq("receipt:android"));
        assertThat(event.getValue().getType()).isEqualTo(CanonicalEventType.CHARGED);
        assertThat(event.getValue().getProviderEventId()).isEqualTo("receipt:GPA.1234-5678");
    }

    @Test
    void laterReceiptForSamePeriodIsUpdate() {
        Instant expiry = NOW.plus(Duration.ofDays(30));
        SubscriptionEntity existing = existing(SubscriptionStatus.ACTIVE, expiry);
        stubValidation(validResult(expiry));
        when(subscriptionRepository.findByProviderAndProviderSubscriptionId(ProviderType.GOOGLE_PLAY, "tok-1"))
                .thenReturn(Optional.of(existing));
        when(recorder.record(any(), any(), any())).thenReturn(LedgerResult.builder().outcome(TransitionOutcome.NO_CHANGE).build());

        service.validateReceipt("user-1", RECEIPT, ReceiptPlatform.ANDROID);

        ArgumentCaptor<CanonicalEvent> event = ArgumentCaptor.forClass(CanonicalEvent.class);
        verify(recorder).record(any(), event.capture(), any());
        assertThat(event.getValue().getType()).isEqualTo(CanonicalEventType.UPDATED);
    }

    @Test
    void receiptForTerminalSubscriptionLeavesLedgerUntouched() {
        SubscriptionEntity existing = existing(SubscriptionStatus.EXPIRED, NOW.minus(Duration.ofDays(3)));
        stubValidation(validResult(NOW.plus(Duration.ofDays(30))));
        when(subscriptionRepository.findByProviderAndProviderSubscriptionId(ProviderType.GOOGLE_PLAY, "tok-1"))
                .thenReturn(Optional.of(existing));

        ReceiptValidationOutcome outcome = service.validateReceipt("user-1", RECEIPT, ReceiptPlatform.ANDROID);

        assertThat(outcome.getSubscription()).isSameAs(existing);
        verify(recorder, never()).record(any(), any(), any());
        verify(ledgerService, never()).createSubscription(any(), any());
    }

    @Test
    void receiptRegisteredToAnotherUserIsRejected() {
        stubValidation(validResult(NOW.plus(Duration.ofDays(30))));
        when(receiptRepository.findByProviderAndTransactionId(ProviderType.GOOGLE_PLAY, "tok-1"))
                .thenReturn(Optional.of(IapReceiptEntity.builder()
                        .provider(ProviderType.GOOGLE_PLAY).transactionId("tok-1").userId("someone-else").build()));

        assertThatThrownBy(() -> service.validateReceipt("user-1", RECEIPT, ReceiptPlatform.ANDROID))
                .isInstanceOf(VerificationException.class)
                .extracting("code").isEqualTo("RECEIPT_USER_MISMATCH");
        verify(auditLogger).logVerificationRejected(eq(ProviderType.GOOGLE_PLAY), any(), any());
    }

    @Test
    void markRefundedUpdatesStoredReceipt() {
        IapReceiptEntity row = IapReceiptEntity.builder()
                .provider(ProviderType.GOOGLE_PLAY).transactionId("tok-1").userId("user-1")
                .validationStatus(ReceiptValidationStatus.VALID).build();
        when(receiptRepository.findByProviderAndTransactionId(ProviderType.GOOGLE_PLAY, "tok-1")).thenReturn(Optional.of(row));

        service.markRefunded(ProviderType.GOOGLE_PLAY, "tok-1");

        assertThat(row.getValidationStatus()).isEqualTo(ReceiptValidationStatus.REFUNDED);
        verify(receiptRepository).save(row);
    }

    private void stubValidation(ReceiptValidationResult result) {
        when(providerCaller.call(eq(ProviderType.GOOGLE_PLAY), eq("validateReceipt"), any()))
                .thenReturn(ProviderCallResult.success(result));
    }

    private static ReceiptValidationResult validResult(Instant expiry) {
        return ReceiptValidationResult.builder()
                .provider(ProviderType.GOOGLE_PLAY)
                .valid(true)
                .status(SubscriptionStatus.ACTIVE)
                .providerSubscriptionId("tok-1")
                .productId("premium_monthly")
                .transactionId("GPA.1234-5678")
                .purchaseDate(NOW.minus(Duration.ofDays(1)))
                .expiryDate(expiry)
                .autoRenewing(true)
                .build();
    }

    private static SubscriptionEntity existing(SubscriptionStatus status, Instant periodEnd) {
        return SubscriptionEntity.builder()
                .id(UUID.randomUUID())
                .userId("user-1")
                .provider(ProviderType.GOOGLE_PLAY)
                .providerSubscriptionId("tok-1")
                .status(status)
                .currentPeriodEnd(periodEnd)
                .build();
    }
}
