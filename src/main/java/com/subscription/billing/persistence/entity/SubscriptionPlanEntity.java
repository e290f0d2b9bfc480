package com.subscription.billing.persistence.entity;

import com.subscription.billing.domain.ProviderType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Maps an internal plan code to the plan id and price a provider knows it by.
 */
@Entity
@Table(name = "subscription_plan_providers",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_plan_provider", columnNames = {"plan_code", "provider"})
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionPlanEntity {

    @Id
    @Column(name = "id", nullable = false)
    private UUID id;

    @Column(name = "plan_code", nullable = false, length = 64)
    private String planCode;

    @Enumerated(EnumType.STRING)
    @Column(name = "provider", nullable = false, length = 32)
    private ProviderType provider;

    @Column(name = "provider_plan_id", nullable = false)
    private String providerPlanId;

    @Column(name = "amount_minor", nullable = false)
    private Long amountMinor;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "active", nullable = false)
    private boolean active;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
    }
}
