package com.subscription.billing.core;

import com.subscription.billing.canonical.EventCanonicalizer;
import com.subscription.billing.compliance.ComplianceAuditLogger;
import com.subscription.billing.domain.CanonicalEvent;
import com.subscription.billing.domain.ProviderSubscriptionDetails;
import com.subscription.billing.persistence.service.LedgerResult;
import com.subscription.billing.persistence.service.WebhookEventStore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs provider fetches off the request path: after state conflicts, after sync-worthy store
 * notifications, and for notifications that only make sense with fresh provider state.
 * Transient failures are retried with linear backoff; exhaustion or a permanent failure is a dead letter.
 */
@Slf4j
@Service
public class ReconciliationScheduler {

    private final ResilientProviderCaller providerCaller;
    private final EventCanonicalizer canonicalizer;
    private final SubscriptionEventRecorder recorder;
    private final WebhookEventStore webhookEventStore;
    private final ComplianceAuditLogger auditLogger;
    private final Clock clock;
    private final ScheduledExecutorService executorService;

    @Value("${billing.reconciliation.max-retries:3}")
    private int maxRetries;

    @Value("${billing.reconciliation.retry-delay-ms:5000}")
    private long retryDelayMs;

    public ReconciliationScheduler(ResilientProviderCaller providerCaller,
                                   EventCanonicalizer canonicalizer,
                                   SubscriptionEventRecorder recorder,
                                   WebhookEventStore webhookEventStore,
                                   ComplianceAuditLogger auditLogger,
                                   Clock clock,
                                   @Value("${billing.reconciliation.pool-size:4}") int poolSize) {
        this.providerCaller = providerCaller;
        this.canonicalizer = canonicalizer;
        this.recorder = recorder;
        this.webhookEventStore = webhookEventStore;
        this.auditLogger = auditLogger;
        this.clock = clock;
        this.executorService = Executors.newScheduledThreadPool(poolSize);
    }

    public void schedule(ReconciliationTask task) {
        log.info("Scheduling reconciliation for subscription {} ({}): {}", task.getSubscriptionId(),
                task.getProvider().getToken(), task.getReason());
        CompletableFuture.runAsync(() -> runAttempt(task, 0), executorService)
                .exceptionally(ex -> {
                    log.error("Failed to run reconciliation for subscription {}", task.getSubscriptionId(), ex);
                    return null;
                });
    }

    /**
     * One fetch attempt. Package-private so tests can drive attempts without the executor.
     */
    void runAttempt(ReconciliationTask task, int attempt) {
        ProviderCallResult<ProviderSubscriptionDetails> fetched = providerCaller.call(task.getProvider(), "fetchSubscription",
                p -> p.fetchSubscription(task.getProviderSubscriptionId()));

        if (fetched.isSuccess()) {
            try {
                LedgerResult result = recorder.record(task.getSubscriptionId(), eventFor(task, fetched.getValue()),
                        "reconciliation:" + task.getReason());
                log.info("Reconciled subscription {}: outcome={} status={}", task.getSubscriptionId(),
                        result.getOutcome(), result.getNewStatus());
                if (task.getWebhookEventId() != null) {
                    webhookEventStore.markProcessed(task.getWebhookEventId(), task.getSubscriptionId());
                }
            } catch (RuntimeException e) {
                retryOrDeadLetter(task, attempt, "ledger write failed: " + e.getMessage());
            }
            return;
        }

        String reason = fetched.getError().getCode() + ": " + fetched.getError().getMessage();
        if (fetched.isRetryable()) {
            retryOrDeadLetter(task, attempt, reason);
        } else {
            deadLetter(task, attempt + 1, reason);
        }
    }

    private CanonicalEvent eventFor(ReconciliationTask task, ProviderSubscriptionDetails details) {
        CanonicalEvent pending = task.getPendingEvent();
        if (pending == null) {
            return canonicalizer.fromProviderDetails(details, clock.instant(), "reconciliation:" + task.getReason());
        }
        CanonicalEvent.CanonicalEventBuilder merged = pending.toBuilder()
                .requiresProviderFetch(false)
                .providerStatus(details.getStatus());
        if (details.getCurrentPeriodStart() != null) {
            merged.periodStart(details.getCurrentPeriodStart());
        }
        if (details.getCurrentPeriodEnd() != null) {
            merged.periodEnd(details.getCurrentPeriodEnd());
        }
        if (details.getNextBillingAt() != null) {
            merged.nextBillingAt(details.getNextBillingAt());
        }
        if (details.getPlanId() != null) {
            merged.providerPlanId(details.getPlanId());
        }
        return merged.build();
    }

    private void retryOrDeadLetter(ReconciliationTask task, int attempt, String reason) {
        if (attempt < maxRetries) {
            long delay = retryDelayMs * (attempt + 1);
            log.warn("Reconciliation for subscription {} failed (attempt {}), retrying in {}ms: {}",
                    task.getSubscriptionId(), attempt + 1, delay, reason);
            executorService.schedule(() -> runAttempt(task, attempt + 1), delay, TimeUnit.MILLISECONDS);
        } else {
            deadLetter(task, attempt + 1, reason);
        }
    }

    private void deadLetter(ReconciliationTask task, int attempts, String reason) {
        auditLogger.logDeadLetter(task.getProvider(), task.getSubscriptionId(), task.getReason() + " / " + reason, attempts);
        if (task.getWebhookEventId() != null) {
            webhookEventStore.markFailed(task.getWebhookEventId(), task.getSubscriptionId(), reason);
        }
    }

    @PreDestroy
    void shutdown() {
        executorService.shutdownNow();
    }
}
