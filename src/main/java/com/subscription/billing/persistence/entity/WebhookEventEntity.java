package com.subscription.billing.persistence.entity;

import com.subscription.billing.domain.ProviderType;
import com.subscription.billing.domain.WebhookProcessingStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Inbox row for one provider notification delivery.
 */
@Entity
@Table(name = "webhook_events",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_webhook_provider_notification", columnNames = {"provider", "notification_id"})
    },
    indexes = {
        @Index(name = "idx_webhook_status", columnList = "status"),
        @Index(name = "idx_webhook_received_at", columnList = "received_at")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookEventEntity {

    @Id
    @Column(name = "id", nullable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "provider", nullable = false, length = 32)
    private ProviderType provider;

    @Column(name = "notification_id", nullable = false)
    private String notificationId;

    @Column(name = "event_type", length = 100)
    private String eventType;

    @Column(name = "payload", columnDefinition = "text")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private WebhookProcessingStatus status;

    @Column(name = "subscription_id")
    private UUID subscriptionId;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "received_at", nullable = false, updatable = false)
    private Instant receivedAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
        if (receivedAt == null) {
            receivedAt = Instant.now();
        }
    }
}
