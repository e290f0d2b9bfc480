package com.subscription.billing.api;

import com.subscription.billing.core.CreateSubscriptionResult;
import com.subscription.billing.core.SubscriptionService;
import com.subscription.billing.persistence.entity.SubscriptionEntity;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Subscription management for the authenticated user. The caller is identified by the
 * {@code X-User-Id} header set by the gateway.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/subscriptions")
@RequiredArgsConstructor
@Tag(name = "Subscriptions", description = "Create, inspect, cancel and resume recurring subscriptions")
public class SubscriptionController {

    static final String USER_HEADER = "X-User-Id";

    private final SubscriptionService subscriptionService;

    @PostMapping
    @Operation(summary = "Create subscription",
            description = "Opens a recurring subscription at the provider for the given plan. "
                    + "Returns the hosted checkout link when the provider requires customer authorization.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Subscription created at status created.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = CreateSubscriptionResponseDto.class))),
            @ApiResponse(responseCode = "400", description = "Validation failed or unsupported provider."),
            @ApiResponse(responseCode = "404", description = "PLAN_NOT_FOUND"),
            @ApiResponse(responseCode = "409", description = "SUBSCRIPTION_ALREADY_EXISTS"),
            @ApiResponse(responseCode = "502", description = "Provider unavailable. Retry later.")
    })
    public ResponseEntity<CreateSubscriptionResponseDto> create(@RequestHeader(USER_HEADER) String userId,
                                                                @Valid @RequestBody CreateSubscriptionRequestDto dto) {
        CreateSubscriptionResult result = subscriptionService.create(userId, dto.getPlanCode(), dto.getProvider(),
                dto.getPromotionalCampaignId());
        return ResponseEntity.ok(CreateSubscriptionResponseDto.from(result));
    }

    @GetMapping("/current")
    @Operation(summary = "Current subscription", description = "The user's live subscription, or the most recent one.")
    public ResponseEntity<SubscriptionResponseDto> current(@RequestHeader(USER_HEADER) String userId) {
        return ResponseEntity.ok(subscriptionService.getCurrent(userId)
                .map(s -> SubscriptionResponseDto.from(s, null))
                .orElseGet(() -> SubscriptionResponseDto.from(null, "No subscription")));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get subscription by id")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Subscription found.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = SubscriptionResponseDto.class))),
            @ApiResponse(responseCode = "404", description = "SUBSCRIPTION_NOT_FOUND")
    })
    public ResponseEntity<SubscriptionResponseDto> get(@RequestHeader(USER_HEADER) String userId, @PathVariable UUID id) {
        return ResponseEntity.ok(SubscriptionResponseDto.from(subscriptionService.getOwned(userId, id), null));
    }

    @PostMapping("/{id}/cancel")
    @Operation(summary = "Cancel subscription",
            description = "With cancel_at_cycle_end=true access continues until the current period ends.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Cancellation applied.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = CancelSubscriptionResponseDto.class))),
            @ApiResponse(responseCode = "400", description = "SUBSCRIPTION_ALREADY_CANCELLED or operation not supported by the provider."),
            @ApiResponse(responseCode = "404", description = "SUBSCRIPTION_NOT_FOUND")
    })
    public ResponseEntity<CancelSubscriptionResponseDto> cancel(@RequestHeader(USER_HEADER) String userId,
                                                                @PathVariable UUID id,
                                                                @Valid @RequestBody(required = false) CancelSubscriptionRequestDto dto) {
        CancelSubscriptionRequestDto request = dto != null ? dto : new CancelSubscriptionRequestDto();
        SubscriptionEntity cancelled = subscriptionService.cancel(userId, id, request.isCancelAtCycleEnd(), request.getReason());
        return ResponseEntity.ok(CancelSubscriptionResponseDto.from(cancelled));
    }

    @PostMapping("/{id}/resume")
    @Operation(summary = "Resume subscription", description = "Undo a cycle-end cancellation before the period ends.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Subscription active again."),
            @ApiResponse(responseCode = "400", description = "SUBSCRIPTION_NOT_PENDING_CANCELLATION or SUBSCRIPTION_EXPIRED"),
            @ApiResponse(responseCode = "404", description = "SUBSCRIPTION_NOT_FOUND")
    })
    public ResponseEntity<SubscriptionResponseDto> resume(@RequestHeader(USER_HEADER) String userId, @PathVariable UUID id) {
        return ResponseEntity.ok(SubscriptionResponseDto.from(subscriptionService.resume(userId, id), "Subscription resumed"));
    }

    @PostMapping("/{id}/sync")
    @Operation(summary = "Sync with provider", description = "Fetches provider state and applies it through the ledger.")
    public ResponseEntity<SubscriptionResponseDto> sync(@RequestHeader(USER_HEADER) String userId, @PathVariable UUID id) {
        return ResponseEntity.ok(SubscriptionResponseDto.from(subscriptionService.sync(userId, id), "Subscription synced"));
    }
}
