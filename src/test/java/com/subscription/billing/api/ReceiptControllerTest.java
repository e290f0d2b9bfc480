package com.subscription.billing.api;

import com.subscription.billing.core.ReceiptService;
import com.subscription.billing.core.ReceiptValidationOutcome;
import com.subscription.billing.core.exception.VerificationException;
import com.subscription.billing.domain.ProviderType;
import com.subscription.billing.domain.ReceiptPlatform;
import com.subscription.billing.domain.ReceiptValidationResult;
import com.subscription.billing.domain.SubscriptionStatus;
import com.subscription.billing.persistence.entity.SubscriptionEntity;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = ReceiptController.class)
class ReceiptControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ReceiptService receiptService;

    @Test
    void validReceiptReturnsLinkedSubscription() throws Exception {
        Instant expiry = Instant.parse("2026-04-01T00:00:00Z");
        SubscriptionEntity subscription = SubscriptionEntity.builder()
                .id(UUID.randomUUID())
                .userId("user-1")
                .provider(ProviderType.GOOGLE_PLAY)
                .providerSubscriptionId("tok-1")
                .status(SubscriptionStatus.ACTIVE)
                .currentPeriodEnd(expiry)
                .build();
        when(receiptService.validateReceipt("user-1", "premium_monthly:tok-1", ReceiptPlatform.ANDROID))
                .thenReturn(ReceiptValidationOutcome.builder()
                        .validation(ReceiptValidationResult.builder()
                                .provider(ProviderType.GOOGLE_PLAY)
                                .valid(true)
                                .status(SubscriptionStatus.ACTIVE)
                                .providerSubscriptionId("tok-1")
                                .productId("premium_monthly")
                                .expiryDate(expiry)
                                .autoRenewing(true)
                                .build())
                        .subscription(subscription)
                        .created(true)
                        .build());

        mockMvc.perform(post("/api/v1/receipts/validate")
                        .header("X-User-Id", "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"receipt\":\"premium_monthly:tok-1\",\"platform\":\"android\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true))
                .andExpect(jsonPath("$.product_id").value("premium_monthly"))
                .andExpect(jsonPath("$.expiry_date").value("2026-04-01T00:00:00Z"))
                .andExpect(jsonPath("$.subscription.provider").value("google_play"))
                .andExpect(jsonPath("$.subscription.status").value("active"));
    }

    @Test
    void unknownPlatformIsValidationError() throws Exception {
        mockMvc.perform(post("/api/v1/receipts/validate")
                        .header("X-User-Id", "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"receipt\":\"premium_monthly:tok-1\",\"platform\":\"web\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details.platform").value("platform must be android or ios"));
        verifyNoInteractions(receiptService);
    }

    @Test
    void receiptOwnedByAnotherUserIsConflict() throws Exception {
        when(receiptService.validateReceipt(eq("user-2"), anyString(), eq(ReceiptPlatform.IOS)))
                .thenThrow(new VerificationException("Receipt is linked to another account", "RECEIPT_USER_MISMATCH",
                        ProviderType.APPLE_APPSTORE, 409));

        mockMvc.perform(post("/api/v1/receipts/validate")
                        .header("X-User-Id", "user-2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"receipt\":\"premium_monthly:BASE64\",\"platform\":\"ios\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("RECEIPT_USER_MISMATCH"));
    }
}
