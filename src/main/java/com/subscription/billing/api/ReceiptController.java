package com.subscription.billing.api;

import com.subscription.billing.core.ReceiptService;
import com.subscription.billing.core.ReceiptValidationOutcome;
import com.subscription.billing.domain.ReceiptPlatform;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/receipts")
@RequiredArgsConstructor
@Tag(name = "Receipts", description = "Store purchase validation")
public class ReceiptController {

    private final ReceiptService receiptService;

    @PostMapping("/validate")
    @Operation(summary = "Validate store receipt",
            description = "Looks the purchase up at Google Play or the App Store and applies the result to the user's subscription.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Validated. body.valid tells whether the purchase grants access."),
            @ApiResponse(responseCode = "400", description = "INVALID_RECEIPT_FORMAT, PLATFORM_MISMATCH or product mismatch"),
            @ApiResponse(responseCode = "409", description = "RECEIPT_USER_MISMATCH"),
            @ApiResponse(responseCode = "502", description = "Store unavailable. Retry later.")
    })
    public ResponseEntity<ReceiptValidationResponseDto> validate(@RequestHeader(SubscriptionController.USER_HEADER) String userId,
                                                                 @Valid @RequestBody ReceiptValidationRequestDto dto) {
        ReceiptValidationOutcome outcome = receiptService.validateReceipt(userId, dto.getReceipt(),
                ReceiptPlatform.of(dto.getPlatform()));
        return ResponseEntity.ok(ReceiptValidationResponseDto.from(outcome));
    }
}
