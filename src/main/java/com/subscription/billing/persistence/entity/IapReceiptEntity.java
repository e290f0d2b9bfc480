package com.subscription.billing.persistence.entity;

import com.subscription.billing.domain.ProviderType;
import com.subscription.billing.domain.ReceiptValidationStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Last known validation of a store purchase, keyed by purchase token (Google Play) or original
 * transaction id (App Store).
 */
@Entity
@Table(name = "iap_receipts",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_receipt_provider_transaction", columnNames = {"provider", "transaction_id"})
    },
    indexes = {
        @Index(name = "idx_receipt_user_id", columnList = "user_id"),
        @Index(name = "idx_receipt_subscription_id", columnList = "subscription_id")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IapReceiptEntity {

    @Id
    @Column(name = "id", nullable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "provider", nullable = false, length = 32)
    private ProviderType provider;

    @Column(name = "transaction_id", nullable = false, length = 512)
    private String transactionId;

    @Column(name = "product_id", nullable = false)
    private String productId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "subscription_id")
    private UUID subscriptionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "validation_status", nullable = false, length = 16)
    private ReceiptValidationStatus validationStatus;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "last_validated_at")
    private Instant lastValidatedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
        createdAt = Instant.now();
    }
}
