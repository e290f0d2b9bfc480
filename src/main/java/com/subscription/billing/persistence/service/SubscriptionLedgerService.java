package com.subscription.billing.persistence.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.subscription.billing.core.SubscriptionStateMachine;
import com.subscription.billing.core.Transition;
import com.subscription.billing.core.exception.SubscriptionOperationException;
import com.subscription.billing.domain.CanonicalEvent;
import com.subscription.billing.domain.PaymentSnapshot;
import com.subscription.billing.domain.SubscriptionStatus;
import com.subscription.billing.domain.TransitionOutcome;
import com.subscription.billing.persistence.entity.SubscriptionEntity;
import com.subscription.billing.persistence.entity.SubscriptionHistoryEntity;
import com.subscription.billing.persistence.entity.SubscriptionInvoiceEntity;
import com.subscription.billing.persistence.repository.SubscriptionHistoryRepository;
import com.subscription.billing.persistence.repository.SubscriptionInvoiceRepository;
import com.subscription.billing.persistence.repository.SubscriptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Writes subscription transitions and their ledger rows in one transaction.
 * <p>
 * The subscription row is locked for the duration, so concurrent deliveries for the same
 * subscription are applied one after the other. A concurrent insert of the same idempotency key
 * surfaces as {@link org.springframework.dao.DataIntegrityViolationException} from the flush;
 * callers treat it as a duplicate.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionLedgerService {

    private final SubscriptionRepository subscriptionRepository;
    private final SubscriptionHistoryRepository historyRepository;
    private final SubscriptionInvoiceRepository invoiceRepository;
    private final SubscriptionStateMachine stateMachine;
    private final ObjectMapper objectMapper;

    /**
     * Apply {@code event} to the subscription and record it.
     * @throws SubscriptionOperationException when the subscription does not exist
     */
    @Transactional
    public LedgerResult record(UUID subscriptionId, CanonicalEvent event) {
        SubscriptionEntity subscription = subscriptionRepository.findByIdForUpdate(subscriptionId)
                .orElseThrow(() -> SubscriptionOperationException.notFound(subscriptionId.toString()));

        String idempotencyKey = event.idempotencyKey(subscriptionId);
        if (historyRepository.existsByIdempotencyKey(idempotencyKey)) {
            log.info("Duplicate event ignored: subscriptionId={}, key={}", subscriptionId, idempotencyKey);
            return LedgerResult.builder()
                    .subscriptionId(subscriptionId)
                    .userId(subscription.getUserId())
                    .provider(subscription.getProvider())
                    .providerSubscriptionId(subscription.getProviderSubscriptionId())
                    .idempotencyKey(idempotencyKey)
                    .eventType(event.getType())
                    .outcome(TransitionOutcome.DUPLICATE)
                    .previousStatus(subscription.getStatus())
                    .newStatus(subscription.getStatus())
                    .build();
        }

        Transition transition = stateMachine.apply(subscription.toState(), event);
        if (transition.isApplied()) {
            subscription.applyState(transition.getState());
            subscriptionRepository.save(subscription);
        }

        historyRepository.saveAndFlush(historyRow(subscription, event, transition.getOutcome(),
                transition.getPreviousStatus(), transition.getNote(), idempotencyKey));

        if (event.getPayment() != null) {
            recordInvoice(subscription, event);
        }

        log.info("Ledger: subscriptionId={}, event={}, outcome={}, {} -> {}", subscriptionId,
                event.getType().getToken(), transition.getOutcome(),
                transition.getPreviousStatus().getToken(), transition.getNewStatus().getToken());

        return LedgerResult.builder()
                .subscriptionId(subscriptionId)
                .userId(subscription.getUserId())
                .provider(subscription.getProvider())
                .providerSubscriptionId(subscription.getProviderSubscriptionId())
                .idempotencyKey(idempotencyKey)
                .eventType(event.getType())
                .outcome(transition.getOutcome())
                .previousStatus(transition.getPreviousStatus())
                .newStatus(transition.getNewStatus())
                .note(transition.getNote())
                .build();
    }

    /**
     * Persist a new subscription together with its first ledger row.
     */
    @Transactional
    public LedgerResult createSubscription(SubscriptionEntity subscription, CanonicalEvent initialEvent) {
        if (subscription.getLastEventAt() == null) {
            subscription.setLastEventAt(initialEvent.getOccurredAt());
        }
        SubscriptionEntity saved = subscriptionRepository.saveAndFlush(subscription);
        String idempotencyKey = initialEvent.idempotencyKey(saved.getId());
        historyRepository.saveAndFlush(historyRow(saved, initialEvent, TransitionOutcome.APPLIED, null,
                "subscription created", idempotencyKey));
        if (initialEvent.getPayment() != null) {
            recordInvoice(saved, initialEvent);
        }
        log.info("Ledger: subscription created id={}, provider={}, status={}",
                saved.getId(), saved.getProvider().getToken(), saved.getStatus().getToken());

        return LedgerResult.builder()
                .subscriptionId(saved.getId())
                .userId(saved.getUserId())
                .provider(saved.getProvider())
                .providerSubscriptionId(saved.getProviderSubscriptionId())
                .idempotencyKey(idempotencyKey)
                .eventType(initialEvent.getType())
                .outcome(TransitionOutcome.APPLIED)
                .newStatus(saved.getStatus())
                .note("subscription created")
                .build();
    }

    @Transactional(readOnly = true)
    public List<SubscriptionHistoryEntity> history(UUID subscriptionId) {
        return historyRepository.findBySubscriptionIdOrderByCreatedAtAsc(subscriptionId);
    }

    private SubscriptionHistoryEntity historyRow(SubscriptionEntity subscription, CanonicalEvent event,
                                                 TransitionOutcome outcome,
                                                 SubscriptionStatus previousStatus,
                                                 String note, String idempotencyKey) {
        PaymentSnapshot payment = event.getPayment();
        return SubscriptionHistoryEntity.builder()
                .subscriptionId(subscription.getId())
                .userId(subscription.getUserId())
                .eventType(event.getType())
                .previousStatus(previousStatus)
                .newStatus(subscription.getStatus())
                .outcome(outcome)
                .idempotencyKey(idempotencyKey)
                .providerEventId(event.getProviderEventId())
                .nativeEventType(event.getNativeEventType())
                .paymentId(payment != null ? payment.getPaymentId() : null)
                .paymentAmountMinor(payment != null ? payment.getAmount() : null)
                .paymentStatus(payment != null ? payment.getStatus() : null)
                .eventData(toJson(event.getPayload()))
                .notes(note)
                .eventTimestamp(event.getOccurredAt())
                .build();
    }

    private void recordInvoice(SubscriptionEntity subscription, CanonicalEvent event) {
        PaymentSnapshot payment = event.getPayment();
        if (payment.getPaymentId() == null || invoiceRepository.existsByProviderPaymentId(payment.getPaymentId())) {
            return;
        }
        invoiceRepository.save(SubscriptionInvoiceEntity.builder()
                .subscriptionId(subscription.getId())
                .providerPaymentId(payment.getPaymentId())
                .amountMinor(payment.getAmount())
                .currency(payment.getCurrency())
                .periodStart(event.getPeriodStart())
                .periodEnd(event.getPeriodEnd())
                .status(payment.getStatus())
                .paymentMethod(payment.getMethod())
                .paidAt(payment.getPaidAt())
                .build());
        log.debug("Recorded invoice paymentId={} for subscriptionId={}", payment.getPaymentId(), subscription.getId());
    }

    private String toJson(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize event payload for ledger: {}", e.getMessage());
            return null;
        }
    }
}
