package com.subscription.billing.persistence.entity;

import com.subscription.billing.domain.CanonicalEventType;
import com.subscription.billing.domain.InvoiceStatus;
import com.subscription.billing.domain.SubscriptionStatus;
import com.subscription.billing.domain.TransitionOutcome;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only ledger row, one per accepted event. The unique idempotency key makes a replayed
 * delivery fail at insert time.
 */
@Entity
@Immutable
@Table(name = "subscription_history",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_history_idempotency_key", columnNames = "idempotency_key")
    },
    indexes = {
        @Index(name = "idx_history_subscription_id", columnList = "subscription_id"),
        @Index(name = "idx_history_created_at", columnList = "created_at")
    })
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionHistoryEntity {

    @Id
    @Column(name = "id", nullable = false)
    private UUID id;

    @Column(name = "subscription_id", nullable = false)
    private UUID subscriptionId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 32)
    private CanonicalEventType eventType;

    @Enumerated(EnumType.STRING)
    @Column(name = "previous_status", length = 32)
    private SubscriptionStatus previousStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "new_status", nullable = false, length = 32)
    private SubscriptionStatus newStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 16)
    private TransitionOutcome outcome;

    @Column(name = "idempotency_key", nullable = false)
    private String idempotencyKey;

    @Column(name = "provider_event_id")
    private String providerEventId;

    @Column(name = "native_event_type", length = 100)
    private String nativeEventType;

    @Column(name = "payment_id")
    private String paymentId;

    @Column(name = "payment_amount_minor")
    private Long paymentAmountMinor;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", length = 16)
    private InvoiceStatus paymentStatus;

    @Column(name = "event_data", columnDefinition = "text")
    private String eventData;

    @Column(name = "notes", length = 1000)
    private String notes;

    @Column(name = "event_timestamp")
    private Instant eventTimestamp;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
