package com.subscription.billing.persistence.entity;

import com.subscription.billing.domain.ProviderType;
import com.subscription.billing.domain.SubscriptionState;
import com.subscription.billing.domain.SubscriptionStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One subscription per (user, provider subscription). Status and billing bookkeeping change
 * only through the ledger; rows are never deleted.
 */
@Entity
@Table(name = "subscriptions",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_subscription_provider_ref", columnNames = {"provider", "provider_subscription_id"})
    },
    indexes = {
        @Index(name = "idx_subscription_user_id", columnList = "user_id"),
        @Index(name = "idx_subscription_status", columnList = "status"),
        @Index(name = "idx_subscription_period_end", columnList = "current_period_end")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionEntity {

    @Id
    @Column(name = "id", nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "provider", nullable = false, length = 32)
    private ProviderType provider;

    @Column(name = "provider_subscription_id", nullable = false)
    private String providerSubscriptionId;

    @Column(name = "provider_plan_id")
    private String providerPlanId;

    @Column(name = "provider_customer_id")
    private String providerCustomerId;

    @Column(name = "plan_code", length = 64)
    private String planCode;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private SubscriptionStatus status;

    @Column(name = "current_period_start")
    private Instant currentPeriodStart;

    @Column(name = "current_period_end")
    private Instant currentPeriodEnd;

    @Column(name = "next_billing_at")
    private Instant nextBillingAt;

    /** Null means unlimited. */
    @Column(name = "total_count")
    private Integer totalCount;

    @Column(name = "paid_count", nullable = false)
    private int paidCount;

    @Column(name = "remaining_count")
    private Integer remainingCount;

    @Column(name = "amount_minor")
    private Long amountMinor;

    @Column(name = "currency", length = 3)
    private String currency;

    @Column(name = "cancel_at_cycle_end", nullable = false)
    private boolean cancelAtCycleEnd;

    @Column(name = "cancellation_reason", length = 500)
    private String cancellationReason;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Column(name = "last_event_at")
    private Instant lastEventAt;

    @Column(name = "metadata", columnDefinition = "text")
    private String metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public SubscriptionState toState() {
        return SubscriptionState.builder()
                .status(status)
                .providerPlanId(providerPlanId)
                .currentPeriodStart(currentPeriodStart)
                .currentPeriodEnd(currentPeriodEnd)
                .nextBillingAt(nextBillingAt)
                .totalCount(totalCount)
                .paidCount(paidCount)
                .remainingCount(remainingCount)
                .cancelAtCycleEnd(cancelAtCycleEnd)
                .cancellationReason(cancellationReason)
                .cancelledAt(cancelledAt)
                .lastEventAt(lastEventAt)
                .build();
    }

    public void applyState(SubscriptionState state) {
        this.status = state.getStatus();
        this.providerPlanId = state.getProviderPlanId();
        this.currentPeriodStart = state.getCurrentPeriodStart();
        this.currentPeriodEnd = state.getCurrentPeriodEnd();
        this.nextBillingAt = state.getNextBillingAt();
        this.totalCount = state.getTotalCount();
        this.paidCount = state.getPaidCount();
        this.remainingCount = state.getRemainingCount();
        this.cancelAtCycleEnd = state.isCancelAtCycleEnd();
        this.cancellationReason = state.getCancellationReason();
        this.cancelledAt = state.getCancelledAt();
        this.lastEventAt = state.getLastEventAt();
    }
}
