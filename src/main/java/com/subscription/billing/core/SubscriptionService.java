package com.subscription.billing.core;

import com.subscription.billing.canonical.EventCanonicalizer;
import com.subscription.billing.compliance.ComplianceAuditLogger;
import com.subscription.billing.core.exception.StateConflictException;
import com.subscription.billing.core.exception.SubscriptionOperationException;
import com.subscription.billing.domain.CanonicalEvent;
import com.subscription.billing.domain.CanonicalEventType;
import com.subscription.billing.domain.CreateSubscriptionParams;
import com.subscription.billing.domain.ProviderSubscriptionDetails;
import com.subscription.billing.domain.ProviderSubscriptionResponse;
import com.subscription.billing.domain.ProviderType;
import com.subscription.billing.domain.SubscriptionStatus;
import com.subscription.billing.domain.TransitionOutcome;
import com.subscription.billing.persistence.entity.SubscriptionEntity;
import com.subscription.billing.persistence.entity.SubscriptionPlanEntity;
import com.subscription.billing.persistence.repository.SubscriptionPlanRepository;
import com.subscription.billing.persistence.repository.SubscriptionRepository;
import com.subscription.billing.persistence.service.LedgerResult;
import com.subscription.billing.persistence.service.SubscriptionLedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * User-initiated subscription management. Every state change goes through the ledger; the
 * provider is called first so the ledger never claims something the provider has not done.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionService {

    private static final Set<SubscriptionStatus> BLOCKING = EnumSet.of(
            SubscriptionStatus.ACTIVE, SubscriptionStatus.AUTHENTICATED, SubscriptionStatus.PENDING_CANCELLATION);
    private static final Set<SubscriptionStatus> LIVE = EnumSet.of(
            SubscriptionStatus.CREATED, SubscriptionStatus.AUTHENTICATED, SubscriptionStatus.ACTIVE,
            SubscriptionStatus.PENDING_CANCELLATION, SubscriptionStatus.PAUSED);
    static final String DEFAULT_CANCEL_REASON = "user_requested";

    private final SubscriptionRepository subscriptionRepository;
    private final SubscriptionPlanRepository planRepository;
    private final SubscriptionLedgerService ledgerService;
    private final SubscriptionEventRecorder recorder;
    private final ResilientProviderCaller providerCaller;
    private final EventCanonicalizer canonicalizer;
    private final ComplianceAuditLogger auditLogger;
    private final Clock clock;

    public CreateSubscriptionResult create(String userId, String planCode, String providerToken,
                                           String promotionalCampaignId) {
        ProviderType providerType = ProviderType.fromToken(providerToken)
                .orElseThrow(() -> new SubscriptionOperationException("Unknown provider: " + providerToken,
                        SubscriptionOperationException.INVALID_PROVIDER, 400));

        if (!subscriptionRepository.findByUserIdAndStatusIn(userId, BLOCKING).isEmpty()) {
            throw new SubscriptionOperationException("User already has an active subscription",
                    SubscriptionOperationException.ALREADY_EXISTS, 409);
        }

        SubscriptionPlanEntity plan = planRepository.findByPlanCodeAndProviderAndActiveTrue(planCode, providerType)
                .orElseThrow(() -> new SubscriptionOperationException("Plan not found: " + planCode,
                        SubscriptionOperationException.PLAN_NOT_FOUND, 404));

        CreateSubscriptionParams params = CreateSubscriptionParams.builder()
                .userId(userId)
                .planCode(planCode)
                .providerPlanId(plan.getProviderPlanId())
                .promotionalCampaignId(promotionalCampaignId)
                .notes(Map.of("user_id", userId, "plan_code", planCode))
                .build();
        ProviderSubscriptionResponse response = providerCaller.call(providerType, "createSubscription",
                p -> p.createSubscription(params)).getOrThrow();

        Instant now = clock.instant();
        CanonicalEvent createdEvent = CanonicalEvent.builder()
                .provider(providerType)
                .type(CanonicalEventType.CREATED)
                .providerSubscriptionId(response.getProviderSubscriptionId())
                .providerEventId("create:" + response.getProviderSubscriptionId())
                .nativeEventType("api.create")
                .occurredAt(now)
                .providerPlanId(plan.getProviderPlanId())
                .build();
        SubscriptionEntity subscription = SubscriptionEntity.builder()
                .userId(userId)
                .provider(providerType)
                .providerSubscriptionId(response.getProviderSubscriptionId())
                .providerPlanId(plan.getProviderPlanId())
                .planCode(planCode)
                .status(response.getStatus() != null ? response.getStatus() : SubscriptionStatus.CREATED)
                .amountMinor(plan.getAmountMinor())
                .currency(plan.getCurrency())
                .lastEventAt(now)
                .build();

        LedgerResult created;
        try {
            created = ledgerService.createSubscription(subscription, createdEvent);
        } catch (RuntimeException e) {
            log.error("Persisting subscription {} failed, cancelling it at {}", response.getProviderSubscriptionId(),
                    providerType.getToken(), e);
            cancelOrphan(providerType, response.getProviderSubscriptionId());
            throw e;
        }
        recorder.afterCommit(created, createdEvent, "api:create");
        auditLogger.logUserOperation("CREATED", userId, created.getSubscriptionId(), "plan=" + planCode);

        return CreateSubscriptionResult.builder()
                .subscription(reload(created.getSubscriptionId(), subscription))
                .authorizationUrl(response.getAuthorizationUrl())
                .build();
    }

    public SubscriptionEntity cancel(String userId, UUID subscriptionId, boolean cancelAtCycleEnd, String reason) {
        SubscriptionEntity subscription = getOwned(userId, subscriptionId);
        SubscriptionStatus status = subscription.getStatus();
        if (status.isTerminal() || (status == SubscriptionStatus.PENDING_CANCELLATION && cancelAtCycleEnd)) {
            throw new SubscriptionOperationException("Subscription is already cancelled",
                    SubscriptionOperationException.ALREADY_CANCELLED, 400);
        }

        providerCaller.call(subscription.getProvider(), "cancelSubscription", p -> {
            p.cancelSubscription(subscription.getProviderSubscriptionId(), cancelAtCycleEnd);
            return Boolean.TRUE;
        }).getOrThrow();

        CanonicalEvent event = userEvent(subscription, CanonicalEventType.CANCELLED, "user-cancel")
                .cancelAtCycleEnd(cancelAtCycleEnd)
                .cancellationReason(reason != null && !reason.isBlank() ? reason : DEFAULT_CANCEL_REASON)
                .build();
        LedgerResult result = recordOrThrow(subscription, event);
        auditLogger.logUserOperation("CANCELLED", userId, subscriptionId,
                "cancel_at_cycle_end=" + cancelAtCycleEnd + " status=" + result.getNewStatus().getToken());
        return reload(subscriptionId, subscription);
    }

    public SubscriptionEntity resume(String userId, UUID subscriptionId) {
        SubscriptionEntity subscription = getOwned(userId, subscriptionId);
        if (subscription.getStatus() != SubscriptionStatus.PENDING_CANCELLATION) {
            throw new SubscriptionOperationException("Subscription is not pending cancellation",
                    SubscriptionOperationException.NOT_PENDING_CANCELLATION, 400);
        }
        if (subscription.getCurrentPeriodEnd() != null && !subscription.getCurrentPeriodEnd().isAfter(clock.instant())) {
            throw new SubscriptionOperationException("Subscription period has already ended",
                    SubscriptionOperationException.EXPIRED, 400);
        }

        providerCaller.call(subscription.getProvider(), "resumeSubscription", p -> {
            p.resumeSubscription(subscription.getProviderSubscriptionId());
            return Boolean.TRUE;
        }).getOrThrow();

        CanonicalEvent event = userEvent(subscription, CanonicalEventType.ACTIVATED, "user-resume").build();
        recordOrThrow(subscription, event);
        auditLogger.logUserOperation("RESUMED", userId, subscriptionId, null);
        return reload(subscriptionId, subscription);
    }

    /**
     * Pull the provider's view and apply it as an {@code updated} event.
     */
    public SubscriptionEntity sync(String userId, UUID subscriptionId) {
        SubscriptionEntity subscription = getOwned(userId, subscriptionId);
        ProviderSubscriptionDetails details = providerCaller.call(subscription.getProvider(), "fetchSubscription",
                p -> p.fetchSubscription(subscription.getProviderSubscriptionId())).getOrThrow();
        CanonicalEvent event = canonicalizer.fromProviderDetails(details, clock.instant(), "user_sync");
        LedgerResult result = recorder.record(subscriptionId, event, "api:sync");
        log.info("Synced subscription {}: outcome={}", subscriptionId, result.getOutcome());
        return reload(subscriptionId, subscription);
    }

    /**
     * The user's live subscription, or their most recent one when none is live.
     */
    public Optional<SubscriptionEntity> getCurrent(String userId) {
        Optional<SubscriptionEntity> live = subscriptionRepository.findByUserIdAndStatusIn(userId, LIVE).stream()
                .max(Comparator.comparing(SubscriptionEntity::getCreatedAt));
        if (live.isPresent()) {
            return live;
        }
        return subscriptionRepository.findFirstByUserIdOrderByCreatedAtDesc(userId);
    }

    public SubscriptionEntity getOwned(String userId, UUID subscriptionId) {
        return subscriptionRepository.findById(subscriptionId)
                .filter(s -> s.getUserId().equals(userId))
                .orElseThrow(() -> SubscriptionOperationException.notFound(subscriptionId.toString()));
    }

    public static boolean canCancel(SubscriptionEntity subscription) {
        return subscription.getStatus() == SubscriptionStatus.ACTIVE
                || subscription.getStatus() == SubscriptionStatus.AUTHENTICATED;
    }

    private CanonicalEvent.CanonicalEventBuilder userEvent(SubscriptionEntity subscription, CanonicalEventType type,
                                                          String source) {
        return CanonicalEvent.builder()
                .provider(subscription.getProvider())
                .type(type)
                .providerSubscriptionId(subscription.getProviderSubscriptionId())
                .providerEventId(source + ":" + UUID.randomUUID())
                .nativeEventType("api." + source)
                .occurredAt(clock.instant());
    }

    private LedgerResult recordOrThrow(SubscriptionEntity subscription, CanonicalEvent event) {
        LedgerResult result = recorder.record(subscription.getId(), event, "api:" + event.getType().getToken());
        if (result.getOutcome() == TransitionOutcome.CONFLICT) {
            throw new StateConflictException(result.getPreviousStatus(), event.getType());
        }
        return result;
    }

    private void cancelOrphan(ProviderType providerType, String providerSubscriptionId) {
        ProviderCallResult<Boolean> cancelled = providerCaller.call(providerType, "cancelSubscription", p -> {
            p.cancelSubscription(providerSubscriptionId, false);
            return Boolean.TRUE;
        });
        if (cancelled.isSuccess()) {
            log.info("Cancelled orphaned provider subscription {}", providerSubscriptionId);
        } else {
            log.error("Could not cancel orphaned provider subscription {}: {}", providerSubscriptionId,
                    cancelled.getError().getMessage());
        }
    }

    private SubscriptionEntity reload(UUID subscriptionId, SubscriptionEntity fallback) {
        return subscriptionRepository.findById(subscriptionId).orElse(fallback);
    }
}
