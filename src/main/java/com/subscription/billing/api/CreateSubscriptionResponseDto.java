package com.subscription.billing.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.subscription.billing.core.CreateSubscriptionResult;
import com.subscription.billing.domain.SubscriptionStatus;
import com.subscription.billing.persistence.entity.SubscriptionEntity;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CreateSubscriptionResponseDto {

    boolean success;
    UUID subscriptionId;
    String providerSubscriptionId;
    String authorizationUrl;
    /** Minor units. */
    Long amount;
    String currency;
    SubscriptionStatus status;
    String message;

    public static CreateSubscriptionResponseDto from(CreateSubscriptionResult result) {
        SubscriptionEntity s = result.getSubscription();
        return CreateSubscriptionResponseDto.builder()
                .success(true)
                .subscriptionId(s.getId())
                .providerSubscriptionId(s.getProviderSubscriptionId())
                .authorizationUrl(result.getAuthorizationUrl())
                .amount(s.getAmountMinor())
                .currency(s.getCurrency())
                .status(s.getStatus())
                .message(result.getAuthorizationUrl() != null
                        ? "Subscription created. Complete authorization at the checkout link."
                        : "Subscription created.")
                .build();
    }
}
