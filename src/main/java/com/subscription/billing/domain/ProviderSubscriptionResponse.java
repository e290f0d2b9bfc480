package com.subscription.billing.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Result of a successful create call. authorizationUrl is the hosted checkout link when the
 * provider uses one.
 */
@Value
@Builder
public class ProviderSubscriptionResponse {

    String providerSubscriptionId;
    SubscriptionStatus status;
    String authorizationUrl;
    Map<String, Object> metadata;
}
