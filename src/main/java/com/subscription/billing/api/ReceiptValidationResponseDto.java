package com.subscription.billing.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.subscription.billing.core.ReceiptValidationOutcome;
import com.subscription.billing.domain.ReceiptValidationResult;
import com.subscription.billing.domain.SubscriptionStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ReceiptValidationResponseDto {

    boolean success;
    boolean valid;
    SubscriptionStatus status;
    String productId;
    Instant expiryDate;
    boolean autoRenewing;
    boolean trial;
    boolean introOffer;
    SubscriptionDto subscription;

    public static ReceiptValidationResponseDto from(ReceiptValidationOutcome outcome) {
        ReceiptValidationResult r = outcome.getValidation();
        return ReceiptValidationResponseDto.builder()
                .success(true)
                .valid(r.isValid())
                .status(r.getStatus())
                .productId(r.getProductId())
                .expiryDate(r.getExpiryDate())
                .autoRenewing(r.isAutoRenewing())
                .trial(r.isTrial())
                .introOffer(r.isIntroOffer())
                .subscription(outcome.getSubscription() != null ? SubscriptionDto.from(outcome.getSubscription()) : null)
                .build();
    }
}
