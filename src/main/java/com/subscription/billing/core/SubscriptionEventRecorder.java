package com.subscription.billing.core;

import com.subscription.billing.compliance.ComplianceAuditLogger;
import com.subscription.billing.domain.CanonicalEvent;
import com.subscription.billing.domain.TransitionOutcome;
import com.subscription.billing.messaging.SubscriptionEventProducer;
import com.subscription.billing.persistence.service.LedgerResult;
import com.subscription.billing.persistence.service.SubscriptionLedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

/**
 * Single entry point for putting a canonical event on a subscription's ledger.
 * Duplicates are detected before the write and, for concurrent deliveries, by the ledger's unique key.
 * Side effects (audit line, Kafka event, idempotency marker) happen after the ledger transaction commits.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionEventRecorder {

    private final SubscriptionLedgerService ledgerService;
    private final IdempotencyService idempotencyService;
    private final SubscriptionEventProducer eventProducer;
    private final ComplianceAuditLogger auditLogger;
    private final Clock clock;

    public LedgerResult record(UUID subscriptionId, CanonicalEvent event, String source) {
        String idempotencyKey = event.idempotencyKey(subscriptionId);
        if (idempotencyService.isProcessed(idempotencyKey)) {
            log.info("Event already recorded, skipping: subscriptionId={}, key={}", subscriptionId, idempotencyKey);
            return duplicate(subscriptionId, event, idempotencyKey);
        }

        LedgerResult result;
        try {
            result = ledgerService.record(subscriptionId, event);
        } catch (DataIntegrityViolationException e) {
            log.info("Concurrent delivery already recorded: subscriptionId={}, key={}", subscriptionId, idempotencyKey);
            return duplicate(subscriptionId, event, idempotencyKey);
        }
        afterCommit(result, event, source);
        return result;
    }

    /**
     * Audit, publish and mark a result produced directly by the ledger (e.g. subscription creation).
     */
    public void afterCommit(LedgerResult result, CanonicalEvent event, String source) {
        if (result.isDuplicate()) {
            return;
        }
        auditLogger.logTransition(result, source);
        if (result.isApplied()) {
            eventProducer.publishTransition(result, event.getPayment());
        }
        idempotencyService.markProcessed(ProcessedEventMarker.builder()
                .idempotencyKey(result.getIdempotencyKey())
                .subscriptionId(result.getSubscriptionId())
                .outcome(result.getOutcome())
                .newStatus(result.getNewStatus())
                .processedAt(clock.instant())
                .build());
    }

    private static LedgerResult duplicate(UUID subscriptionId, CanonicalEvent event, String idempotencyKey) {
        return LedgerResult.builder()
                .subscriptionId(subscriptionId)
                .provider(event.getProvider())
                .providerSubscriptionId(event.getProviderSubscriptionId())
                .idempotencyKey(idempotencyKey)
                .eventType(event.getType())
                .outcome(TransitionOutcome.DUPLICATE)
                .build();
    }
}
