package com.subscription.billing.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CancelSubscriptionRequestDto {

    /** Keep access until the end of the paid period. */
    private boolean cancelAtCycleEnd = true;

    @Size(max = 500)
    private String reason;
}
