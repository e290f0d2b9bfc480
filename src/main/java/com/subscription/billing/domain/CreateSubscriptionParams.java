package com.subscription.billing.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * What a provider needs to open a new recurring subscription.
 */
@Value
@Builder
public class CreateSubscriptionParams {

    String userId;
    String planCode;
    String providerPlanId;
    String promotionalCampaignId;
    /** Provider notes forwarded as-is (Razorpay "notes"). */
    Map<String, String> notes;
}
