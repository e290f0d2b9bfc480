package com.subscription.billing.persistence.entity;

import com.subscription.billing.domain.InvoiceStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One charge attempt reported by a provider. Amounts are captured as reported, never computed.
 */
@Entity
@Table(name = "subscription_invoices",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_invoice_provider_payment_id", columnNames = "provider_payment_id")
    },
    indexes = {
        @Index(name = "idx_invoice_subscription_id", columnList = "subscription_id")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionInvoiceEntity {

    @Id
    @Column(name = "id", nullable = false)
    private UUID id;

    @Column(name = "subscription_id", nullable = false)
    private UUID subscriptionId;

    @Column(name = "provider_payment_id", nullable = false)
    private String providerPaymentId;

    @Column(name = "amount_minor")
    private Long amountMinor;

    @Column(name = "currency", length = 3)
    private String currency;

    @Column(name = "period_start")
    private Instant periodStart;

    @Column(name = "period_end")
    private Instant periodEnd;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private InvoiceStatus status;

    @Column(name = "payment_method", length = 50)
    private String paymentMethod;

    @Column(name = "paid_at")
    private Instant paidAt;

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
