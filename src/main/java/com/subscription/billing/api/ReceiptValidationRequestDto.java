package com.subscription.billing.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

/**
 * Client-submitted store purchase.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ReceiptValidationRequestDto {

    /** {@code productId:purchaseToken} */
    @NotBlank(message = "receipt is required")
    private String receipt;

    @NotBlank(message = "platform is required")
    @Pattern(regexp = "(?i)android|ios", message = "platform must be android or ios")
    private String platform;
}
