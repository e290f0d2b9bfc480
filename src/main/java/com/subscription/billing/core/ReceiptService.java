package com.subscription.billing.core;

import com.subscription.billing.canonical.EventCanonicalizer;
import com.subscription.billing.compliance.ComplianceAuditLogger;
import com.subscription.billing.compliance.SensitiveDataMasker;
import com.subscription.billing.core.exception.VerificationException;
import com.subscription.billing.domain.CanonicalEvent;
import com.subscription.billing.domain.CanonicalEventType;
import com.subscription.billing.domain.ProviderType;
import com.subscription.billing.domain.ReceiptPlatform;
import com.subscription.billing.domain.ReceiptValidationResult;
import com.subscription.billing.domain.ReceiptValidationStatus;
import com.subscription.billing.persistence.entity.IapReceiptEntity;
import com.subscription.billing.persistence.entity.SubscriptionEntity;
import com.subscription.billing.persistence.repository.IapReceiptRepository;
import com.subscription.billing.persistence.repository.SubscriptionRepository;
import com.subscription.billing.persistence.service.LedgerResult;
import com.subscription.billing.persistence.service.SubscriptionLedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Client-submitted store receipts. The store is asked for the authoritative state; the receipt
 * itself is never trusted. The first valid receipt opens the subscription, later ones move it
 * through the state machine.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReceiptService {

    private final ResilientProviderCaller providerCaller;
    private final EventCanonicalizer canonicalizer;
    private final IapReceiptRepository receiptRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final SubscriptionLedgerService ledgerService;
    private final SubscriptionEventRecorder recorder;
    private final ComplianceAuditLogger auditLogger;
    private final Clock clock;

    public ReceiptValidationOutcome validateReceipt(String userId, String receipt, ReceiptPlatform platform) {
        ProviderType providerType = platform.getProviderType();
        ReceiptValidationResult result = providerCaller.call(providerType, "validateReceipt",
                p -> p.validateReceipt(receipt, platform)).getOrThrow();
        Instant now = clock.instant();

        log.info("Receipt {} for user {} validated: valid={}, status={}", SensitiveDataMasker.maskReceipt(receipt),
                userId, result.isValid(), result.getStatus() != null ? result.getStatus().getToken() : null);

        IapReceiptEntity receiptRow = upsertReceipt(userId, result, now);

        Optional<SubscriptionEntity> existing = subscriptionRepository
                .findByProviderAndProviderSubscriptionId(providerType, result.getProviderSubscriptionId());
        if (existing.isEmpty()) {
            if (!result.isValid()) {
                return ReceiptValidationOutcome.builder().validation(result).build();
            }
            try {
                return createFromReceipt(userId, result, receiptRow, now);
            } catch (DataIntegrityViolationException e) {
                log.info("Subscription for receipt {} created concurrently, applying as update",
                        SensitiveDataMasker.maskToken(result.getProviderSubscriptionId()));
                existing = subscriptionRepository.findByProviderAndProviderSubscriptionId(providerType,
                        result.getProviderSubscriptionId());
                if (existing.isEmpty()) {
                    throw e;
                }
            }
        }

        SubscriptionEntity subscription = existing.get();
        if (receiptRow.getSubscriptionId() == null) {
            receiptRow.setSubscriptionId(subscription.getId());
            receiptRepository.save(receiptRow);
        }
        if (subscription.getStatus().isTerminal()) {
            log.info("Receipt for terminal subscription {} ({}), ledger untouched", subscription.getId(),
                    subscription.getStatus().getToken());
            return ReceiptValidationOutcome.builder().validation(result).subscription(subscription).build();
        }

        CanonicalEventType type = advancesPeriod(result, subscription) ? CanonicalEventType.CHARGED : CanonicalEventType.UPDATED;
        CanonicalEvent event = canonicalizer.fromReceipt(result, type, now);
        LedgerResult ledgerResult = recorder.record(subscription.getId(), event, "receipt:" + platform.getToken());
        SubscriptionEntity refreshed = subscriptionRepository.findById(subscription.getId()).orElse(subscription);
        return ReceiptValidationOutcome.builder()
                .validation(result)
                .subscription(refreshed)
                .ledgerResult(ledgerResult)
                .build();
    }

    /**
     * Marks the stored receipt refunded after a store refund or revocation.
     */
    public void markRefunded(ProviderType provider, String providerSubscriptionId) {
        receiptRepository.findByProviderAndTransactionId(provider, providerSubscriptionId).ifPresent(row -> {
            row.setValidationStatus(ReceiptValidationStatus.REFUNDED);
            row.setLastValidatedAt(clock.instant());
            receiptRepository.save(row);
            log.info("Receipt {} marked refunded", SensitiveDataMasker.maskToken(providerSubscriptionId));
        });
    }

    private ReceiptValidationOutcome createFromReceipt(String userId, ReceiptValidationResult result,
                                                       IapReceiptEntity receiptRow, Instant now) {
        CanonicalEvent event = canonicalizer.fromReceipt(result, CanonicalEventType.ACTIVATED, now);
        SubscriptionEntity subscription = SubscriptionEntity.builder()
                .userId(userId)
                .provider(result.getProvider())
                .providerSubscriptionId(result.getProviderSubscriptionId())
                .providerPlanId(result.getProductId())
                .planCode(result.getProductId())
                .status(result.getStatus())
                .currentPeriodStart(result.getPurchaseDate())
                .currentPeriodEnd(result.getExpiryDate())
                .nextBillingAt(result.isAutoRenewing() ? result.getExpiryDate() : null)
                .cancelAtCycleEnd(!result.isAutoRenewing())
                .lastEventAt(now)
                .build();
        LedgerResult created = ledgerService.createSubscription(subscription, event);
        recorder.afterCommit(created, event, "receipt:" + result.getProvider().getToken());

        receiptRow.setSubscriptionId(created.getSubscriptionId());
        receiptRepository.save(receiptRow);
        auditLogger.logUserOperation("CREATED", userId, created.getSubscriptionId(), "store receipt");

        SubscriptionEntity saved = subscriptionRepository.findById(created.getSubscriptionId()).orElse(subscription);
        return ReceiptValidationOutcome.builder()
                .validation(result)
                .subscription(saved)
                .ledgerResult(created)
                .created(true)
                .build();
    }

    private IapReceiptEntity upsertReceipt(String userId, ReceiptValidationResult result, Instant now) {
        IapReceiptEntity row = receiptRepository
                .findByProviderAndTransactionId(result.getProvider(), result.getProviderSubscriptionId())
                .orElseGet(() -> IapReceiptEntity.builder()
                        .provider(result.getProvider())
                        .transactionId(result.getProviderSubscriptionId())
                        .userId(userId)
                        .build());
        if (!userId.equals(row.getUserId())) {
            auditLogger.logVerificationRejected(result.getProvider(), "receipt belongs to another user",
                    SensitiveDataMasker.maskToken(result.getProviderSubscriptionId()));
            throw new VerificationException("Receipt is registered to another user", "RECEIPT_USER_MISMATCH",
                    result.getProvider(), 409);
        }
        row.setProductId(result.getProductId());
        if (row.getValidationStatus() != ReceiptValidationStatus.REFUNDED) {
            row.setValidationStatus(result.isValid() ? ReceiptValidationStatus.VALID : ReceiptValidationStatus.INVALID);
        }
        row.setExpiresAt(result.getExpiryDate());
        row.setLastValidatedAt(now);
        return receiptRepository.save(row);
    }

    private static boolean advancesPeriod(ReceiptValidationResult result, SubscriptionEntity subscription) {
        return result.isValid()
                && result.getExpiryDate() != null
                && (subscription.getCurrentPeriodEnd() == null
                    || result.getExpiryDate().isAfter(subscription.getCurrentPeriodEnd()));
    }
}
