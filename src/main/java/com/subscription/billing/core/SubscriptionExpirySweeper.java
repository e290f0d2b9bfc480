package com.subscription.billing.core;

import com.subscription.billing.domain.CanonicalEvent;
import com.subscription.billing.domain.CanonicalEventType;
import com.subscription.billing.domain.SubscriptionStatus;
import com.subscription.billing.persistence.entity.SubscriptionEntity;
import com.subscription.billing.persistence.repository.SubscriptionRepository;
import com.subscription.billing.persistence.service.LedgerResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Closes out subscriptions whose paid period has elapsed: pending cancellations become cancelled,
 * and cancelled or completed subscriptions expire once the grace period has passed.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "billing.sweep.enabled", havingValue = "true", matchIfMissing = true)
public class SubscriptionExpirySweeper {

    private final SubscriptionRepository subscriptionRepository;
    private final SubscriptionEventRecorder recorder;
    private final Clock clock;
    private final Duration gracePeriod;

    public SubscriptionExpirySweeper(SubscriptionRepository subscriptionRepository,
                                     SubscriptionEventRecorder recorder,
                                     Clock clock,
                                     @Value("${billing.sweep.grace-period-hours:72}") long gracePeriodHours) {
        this.subscriptionRepository = subscriptionRepository;
        this.recorder = recorder;
        this.clock = clock;
        this.gracePeriod = Duration.ofHours(gracePeriodHours);
    }

    @Scheduled(fixedDelayString = "${billing.sweep.interval-ms:300000}",
            initialDelayString = "${billing.sweep.initial-delay-ms:60000}")
    public void sweep() {
        Instant now = clock.instant();
        int cancelled = 0;
        int expired = 0;
        for (SubscriptionEntity s : subscriptionRepository.findByStatusAndPeriodEndedBefore(
                SubscriptionStatus.PENDING_CANCELLATION, now)) {
            if (apply(s, CanonicalEventType.CANCELLED, now)) {
                cancelled++;
            }
        }
        Instant cutoff = now.minus(gracePeriod);
        for (SubscriptionStatus status : new SubscriptionStatus[]{SubscriptionStatus.CANCELLED, SubscriptionStatus.COMPLETED}) {
            for (SubscriptionEntity s : subscriptionRepository.findByStatusAndPeriodEndedBefore(status, cutoff)) {
                if (apply(s, CanonicalEventType.EXPIRED, now)) {
                    expired++;
                }
            }
        }
        if (cancelled > 0 || expired > 0) {
            log.info("Expiry sweep: {} cancelled, {} expired", cancelled, expired);
        }
    }

    private boolean apply(SubscriptionEntity subscription, CanonicalEventType type, Instant now) {
        CanonicalEvent event = CanonicalEvent.builder()
                .provider(subscription.getProvider())
                .type(type)
                .providerSubscriptionId(subscription.getProviderSubscriptionId())
                // one sweep event per period end
                .providerEventId("sweep:" + type.getToken() + ":" + subscription.getCurrentPeriodEnd().getEpochSecond())
                .nativeEventType("sweep")
                .occurredAt(now)
                .cancelAtCycleEnd(Boolean.FALSE)
                .cancellationReason(type == CanonicalEventType.CANCELLED ? subscription.getCancellationReason() : null)
                .build();
        try {
            LedgerResult result = recorder.record(subscription.getId(), event, "sweep");
            return result.isApplied();
        } catch (RuntimeException e) {
            log.warn("Expiry sweep failed for subscription {}: {}", subscription.getId(), e.getMessage());
            return false;
        }
    }
}
