package com.subscription.billing.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CreateSubscriptionRequestDto {

    @NotBlank(message = "plan_code is required")
    private String planCode;

    /** Provider token, e.g. "razorpay". */
    private String provider = "razorpay";

    private String promotionalCampaignId;
}
