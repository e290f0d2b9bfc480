package com.subscription.billing.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import com.subscription.billing.canonical.RazorpayVocabulary;
import com.subscription.billing.core.SubscriptionProvider;
import com.subscription.billing.core.exception.ConfigurationException;
import com.subscription.billing.core.exception.ProviderFetchException;
import com.subscription.billing.domain.CreateSubscriptionParams;
import com.subscription.billing.domain.ProviderSubscriptionDetails;
import com.subscription.billing.domain.ProviderSubscriptionResponse;
import com.subscription.billing.domain.ProviderType;
import com.subscription.billing.domain.SubscriptionStatus;
import com.subscription.billing.verification.WebhookSignatureVerifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Razorpay subscriptions over the REST API with key id / secret basic auth.
 * Receipts are not a Razorpay concept, so {@code validateReceipt} keeps the unsupported default.
 */
@Slf4j
public class RazorpayAdapter implements SubscriptionProvider {

    static final int DEFAULT_TOTAL_COUNT = 360;

    private final String keyId;
    private final String keySecret;
    private final String webhookSecret;
    private final String baseUrl;
    private final RestTemplate restTemplate;

    public RazorpayAdapter(String keyId, String keySecret, String webhookSecret, String baseUrl, RestTemplate restTemplate) {
        if (keyId == null || keyId.isBlank() || keySecret == null || keySecret.isBlank()) {
            throw new ConfigurationException("Razorpay key id and secret are required", "RAZORPAY_CONFIG_MISSING",
                    ProviderType.RAZORPAY);
        }
        if (webhookSecret == null || webhookSecret.isBlank()) {
            log.warn("Razorpay webhook secret is not configured; every webhook will be rejected");
        }
        this.keyId = keyId;
        this.keySecret = keySecret;
        this.webhookSecret = webhookSecret;
        this.baseUrl = baseUrl;
        this.restTemplate = restTemplate;
    }

    @Override
    public ProviderType getProviderType() {
        return ProviderType.RAZORPAY;
    }

    @Override
    public ProviderSubscriptionResponse createSubscription(CreateSubscriptionParams params) {
        Map<String, String> notes = new LinkedHashMap<>();
        if (params.getNotes() != null) {
            notes.putAll(params.getNotes());
        }
        notes.put("user_id", params.getUserId());
        notes.put("plan_code", params.getPlanCode());
        if (params.getPromotionalCampaignId() != null) {
            notes.put("promotional_campaign_id", params.getPromotionalCampaignId());
        }

        Map<String, Object> body = new HashMap<>();
        body.put("plan_id", params.getProviderPlanId());
        body.put("total_count", DEFAULT_TOTAL_COUNT);
        body.put("quantity", 1);
        body.put("customer_notify", 1);
        body.put("notes", notes);

        JsonNode response = exchange(HttpMethod.POST, "/subscriptions", body, "RAZORPAY_SUBSCRIPTION_CREATE_FAILED", "create");
        String id = response.path("id").asText(null);
        if (id == null) {
            throw new ProviderFetchException("Razorpay create response has no subscription id",
                    "RAZORPAY_SUBSCRIPTION_CREATE_FAILED", ProviderType.RAZORPAY, 502);
        }
        log.info("Created Razorpay subscription {} for user {} plan {}", id, params.getUserId(), params.getPlanCode());

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("plan_id", response.path("plan_id").asText(params.getProviderPlanId()));
        if (response.hasNonNull("customer_id")) {
            metadata.put("customer_id", response.path("customer_id").asText());
        }
        return ProviderSubscriptionResponse.builder()
                .providerSubscriptionId(id)
                .status(RazorpayVocabulary.toStatus(response.path("status").asText(null)).orElse(SubscriptionStatus.CREATED))
                .authorizationUrl(response.path("short_url").asText(null))
                .metadata(metadata)
                .build();
    }

    @Override
    public void cancelSubscription(String providerSubscriptionId, boolean cancelAtCycleEnd) {
        Map<String, Object> body = Map.of("cancel_at_cycle_end", cancelAtCycleEnd ? 1 : 0);
        exchange(HttpMethod.POST, "/subscriptions/" + providerSubscriptionId + "/cancel", body,
                "RAZORPAY_SUBSCRIPTION_CANCEL_FAILED", "cancel");
        log.info("Cancelled Razorpay subscription {} (atCycleEnd={})", providerSubscriptionId, cancelAtCycleEnd);
    }

    /**
     * A paused subscription goes through {@code /resume}. Otherwise the scheduled cycle-end
     * cancellation is withdrawn by updating the subscription.
     */
    @Override
    public void resumeSubscription(String providerSubscriptionId) {
        String path = "/subscriptions/" + providerSubscriptionId;
        JsonNode current = exchange(HttpMethod.GET, path, null, "RAZORPAY_SUBSCRIPTION_RESUME_FAILED", "resume");
        if ("paused".equals(current.path("status").asText(null))) {
            exchange(HttpMethod.POST, path + "/resume", Map.of("resume_at", "now"),
                    "RAZORPAY_SUBSCRIPTION_RESUME_FAILED", "resume");
            log.info("Resumed paused Razorpay subscription {}", providerSubscriptionId);
            return;
        }
        exchange(HttpMethod.PATCH, path, Map.of("customer_notify", 1), "RAZORPAY_SUBSCRIPTION_RESUME_FAILED", "resume");
        log.info("Withdrew scheduled cancellation of Razorpay subscription {}", providerSubscriptionId);
    }

    @Override
    public ProviderSubscriptionDetails fetchSubscription(String providerSubscriptionId) {
        JsonNode s = exchange(HttpMethod.GET, "/subscriptions/" + providerSubscriptionId, null,
                "RAZORPAY_SUBSCRIPTION_FETCH_FAILED", "fetch");
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("razorpay_status", s.path("status").asText(null));
        if (s.hasNonNull("customer_id")) {
            metadata.put("customer_id", s.path("customer_id").asText());
        }
        return ProviderSubscriptionDetails.builder()
                .provider(ProviderType.RAZORPAY)
                .providerSubscriptionId(s.path("id").asText(providerSubscriptionId))
                .status(RazorpayVocabulary.toStatus(s.path("status").asText(null)).orElse(null))
                .planId(s.path("plan_id").asText(null))
                .currentPeriodStart(epochSeconds(s.path("current_start")))
                .currentPeriodEnd(epochSeconds(s.path("current_end")))
                .nextBillingAt(epochSeconds(s.path("charge_at")))
                .totalCount(s.hasNonNull("total_count") ? s.path("total_count").asInt() : null)
                .paidCount(s.hasNonNull("paid_count") ? s.path("paid_count").asInt() : null)
                .remainingCount(s.hasNonNull("remaining_count") ? s.path("remaining_count").asInt() : null)
                .autoRenewing(!"cancelled".equals(s.path("status").asText(null)))
                .metadata(metadata)
                .build();
    }

    @Override
    public boolean verifyWebhookSignature(String rawPayload, String signatureHeader) {
        return WebhookSignatureVerifier.verifyHmacSha256Hex(rawPayload, signatureHeader, webhookSecret);
    }

    private JsonNode exchange(HttpMethod method, String path, Map<String, Object> body, String errorCode, String operation) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBasicAuth(keyId, keySecret);
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        try {
            JsonNode response = restTemplate.exchange(baseUrl + path, method, new HttpEntity<>(body, headers), JsonNode.class).getBody();
            if (response == null) {
                throw new ProviderFetchException("Razorpay " + operation + " returned an empty body", errorCode,
                        ProviderType.RAZORPAY, 502);
            }
            return response;
        } catch (RestClientException e) {
            throw ProviderHttpErrors.translate(ProviderType.RAZORPAY, errorCode, operation, e);
        }
    }

    private static Instant epochSeconds(JsonNode node) {
        return node != null && node.isNumber() && node.asLong() > 0 ? Instant.ofEpochSecond(node.asLong()) : null;
    }
}
