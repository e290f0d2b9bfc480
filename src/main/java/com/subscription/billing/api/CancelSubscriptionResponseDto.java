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

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CancelSubscriptionResponseDto {

    boolean success;
    UUID subscriptionId;
    SubscriptionStatus status;
    Instant cancelledAt;
    /** Set while access continues until the period end. */
    Instant activeUntil;
    String message;

    public static CancelSubscriptionResponseDto from(SubscriptionEntity s) {
        boolean pending = s.getStatus() == SubscriptionStatus.PENDING_CANCELLATION;
        return CancelSubscriptionResponseDto.builder()
                .success(true)
                .subscriptionId(s.getId())
                .status(s.getStatus())
                .cancelledAt(s.getCancelledAt())
                .activeUntil(pending ? s.getCurrentPeriodEnd() : null)
                .message(pending
                        ? "Subscription will be cancelled at the end of the current billing period."
                        : "Subscription cancelled.")
                .build();
    }
}
