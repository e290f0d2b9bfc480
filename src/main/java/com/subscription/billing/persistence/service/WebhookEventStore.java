package com.subscription.billing.persistence.service;

import com.subscription.billing.domain.ProviderType;
import com.subscription.billing.domain.WebhookProcessingStatus;
import com.subscription.billing.persistence.entity.WebhookEventEntity;
import com.subscription.billing.persistence.repository.WebhookEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Inbox of received provider notifications, one row per (provider, notification id).
 * Status updates run in their own transaction so they survive a failed ledger write.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookEventStore {

    private static final int MAX_ERROR_LENGTH = 1000;

    private final WebhookEventRepository repository;

    /**
     * Record a delivery. Returns empty when the same notification was already processed or
     * ignored; a pending or failed one is returned again so it can be reprocessed.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<WebhookEventEntity> register(ProviderType provider, String notificationId, String eventType, String payload) {
        Optional<WebhookEventEntity> existing = repository.findByProviderAndNotificationId(provider, notificationId);
        if (existing.isPresent()) {
            WebhookEventEntity entity = existing.get();
            if (entity.getStatus() == WebhookProcessingStatus.PROCESSED || entity.getStatus() == WebhookProcessingStatus.IGNORED) {
                log.info("Webhook {} {} already {}", provider.getToken(), notificationId, entity.getStatus());
                return Optional.empty();
            }
            entity.setAttempts(entity.getAttempts() + 1);
            return Optional.of(repository.save(entity));
        }
        try {
            WebhookEventEntity entity = WebhookEventEntity.builder()
                    .provider(provider)
                    .notificationId(notificationId)
                    .eventType(eventType)
                    .payload(payload)
                    .status(WebhookProcessingStatus.PENDING)
                    .attempts(1)
                    .build();
            return Optional.of(repository.saveAndFlush(entity));
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent delivery of webhook {} {}; leaving it to the first receiver", provider.getToken(), notificationId);
            return Optional.empty();
        }
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markProcessed(UUID webhookEventId, UUID subscriptionId) {
        update(webhookEventId, WebhookProcessingStatus.PROCESSED, subscriptionId, null);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markIgnored(UUID webhookEventId, String reason) {
        update(webhookEventId, WebhookProcessingStatus.IGNORED, null, reason);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID webhookEventId, UUID subscriptionId, String errorMessage) {
        update(webhookEventId, WebhookProcessingStatus.FAILED, subscriptionId, errorMessage);
    }

    private void update(UUID webhookEventId, WebhookProcessingStatus status, UUID subscriptionId, String message) {
        repository.findById(webhookEventId).ifPresentOrElse(entity -> {
            entity.setStatus(status);
            if (subscriptionId != null) {
                entity.setSubscriptionId(subscriptionId);
            }
            entity.setErrorMessage(truncate(message));
            entity.setProcessedAt(Instant.now());
            repository.save(entity);
        }, () -> log.warn("Webhook event {} vanished before it could be marked {}", webhookEventId, status));
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }
}
