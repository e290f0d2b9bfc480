package com.subscription.billing.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.subscription.billing.core.SubscriptionService;
import com.subscription.billing.domain.SubscriptionStatus;
import com.subscription.billing.persistence.entity.SubscriptionEntity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Response for get, resume and sync. {@code subscription} is null when the user has none.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SubscriptionResponseDto {

    boolean success;
    SubscriptionDto subscription;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    NextBilling nextBilling;
    boolean canCancel;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    String message;

    @Value
    public static class NextBilling {
        Instant date;
        Long amount;
        String currency;
    }

    public static SubscriptionResponseDto from(SubscriptionEntity entity, String message) {
        if (entity == null) {
            return SubscriptionResponseDto.builder().success(true).canCancel(false).message(message).build();
        }
        NextBilling nextBilling = null;
        if (entity.getStatus() == SubscriptionStatus.ACTIVE && entity.getNextBillingAt() != null) {
            nextBilling = new NextBilling(entity.getNextBillingAt(), entity.getAmountMinor(), entity.getCurrency());
        }
        return SubscriptionResponseDto.builder()
                .success(true)
                .subscription(SubscriptionDto.from(entity))
                .nextBilling(nextBilling)
                .canCancel(SubscriptionService.canCancel(entity))
                .message(message)
                .build();
    }
}
