package com.subscription.billing.core;

import com.subscription.billing.persistence.entity.SubscriptionEntity;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CreateSubscriptionResult {

    SubscriptionEntity subscription;
    /** Hosted checkout link, when the provider uses one. */
    String authorizationUrl;
}
