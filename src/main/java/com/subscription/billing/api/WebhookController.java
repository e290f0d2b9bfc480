package com.subscription.billing.api;

import com.subscription.billing.core.WebhookReconciliationService;
import com.subscription.billing.core.WebhookResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Provider notification endpoints. Bodies are taken raw so signatures are checked over the
 * exact bytes received. Authentication failures are 4xx; everything authenticated is acknowledged.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/webhooks")
@RequiredArgsConstructor
@Tag(name = "Webhooks", description = "Razorpay webhooks, Google Play RTDN and App Store Server Notifications")
public class WebhookController {

    private final WebhookReconciliationService webhookService;

    @PostMapping(value = "/razorpay", consumes = "application/json")
    @Operation(summary = "Razorpay webhook", description = "Verified with HMAC-SHA256 over the raw body.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Acknowledged."),
            @ApiResponse(responseCode = "400", description = "INVALID_PAYLOAD"),
            @ApiResponse(responseCode = "401", description = "INVALID_SIGNATURE")
    })
    public ResponseEntity<Map<String, Object>> razorpay(@RequestBody String body,
                                                        @RequestHeader(value = "X-Razorpay-Signature", required = false) String signature,
                                                        @RequestHeader(value = "X-Razorpay-Event-Id", required = false) String eventId) {
        return ack(webhookService.handleRazorpay(body, signature, eventId));
    }

    @PostMapping(value = "/google-play", consumes = "application/json")
    @Operation(summary = "Google Play RTDN", description = "Pub/Sub push endpoint authenticated by the push token query parameter.")
    public ResponseEntity<Map<String, Object>> googlePlay(@RequestBody String body,
                                                          @RequestParam(value = "token", required = false) String token) {
        return ack(webhookService.handleGooglePlay(body, token));
    }

    @PostMapping(value = "/apple", consumes = "application/json")
    @Operation(summary = "App Store Server Notification v2", description = "signedPayload JWS verified against the Apple root CA.")
    public ResponseEntity<Map<String, Object>> apple(@RequestBody String body) {
        return ack(webhookService.handleApple(body));
    }

    private static ResponseEntity<Map<String, Object>> ack(WebhookResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("received", true);
        body.put("status", result.getStatus().name().toLowerCase());
        if (result.getSubscriptionId() != null) {
            body.put("subscription_id", result.getSubscriptionId());
        }
        if (result.getOutcome() != null) {
            body.put("outcome", result.getOutcome().name().toLowerCase());
        }
        return ResponseEntity.ok(body);
    }
}
