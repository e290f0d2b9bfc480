package com.subscription.billing.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.subscription.billing.domain.SubscriptionStatus;
import com.subscription.billing.persistence.entity.SubscriptionEntity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Public view of a subscription.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SubscriptionDto {

    UUID id;
    String provider;
    String providerSubscriptionId;
    String planCode;
    SubscriptionStatus status;
    Long amount;
    String currency;
    Instant currentPeriodStart;
    Instant currentPeriodEnd;
    Instant nextBillingAt;
    Integer totalCount;
    int paidCount;
    Integer remainingCount;
    boolean cancelAtCycleEnd;
    String cancellationReason;
    Instant cancelledAt;
    boolean hasAccess;
    Instant createdAt;

    public static SubscriptionDto from(SubscriptionEntity entity) {
        return SubscriptionDto.builder()
                .id(entity.getId())
                .provider(entity.getProvider().getToken())
                .providerSubscriptionId(entity.getProviderSubscriptionId())
                .planCode(entity.getPlanCode())
                .status(entity.getStatus())
                .amount(entity.getAmountMinor())
                .currency(entity.getCurrency())
                .currentPeriodStart(entity.getCurrentPeriodStart())
                .currentPeriodEnd(entity.getCurrentPeriodEnd())
                .nextBillingAt(entity.getNextBillingAt())
                .totalCount(entity.getTotalCount())
                .paidCount(entity.getPaidCount())
                .remainingCount(entity.getRemainingCount())
                .cancelAtCycleEnd(entity.isCancelAtCycleEnd())
                .cancellationReason(entity.getCancellationReason())
                .cancelledAt(entity.getCancelledAt())
                .hasAccess(entity.getStatus().grantsAccess())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
