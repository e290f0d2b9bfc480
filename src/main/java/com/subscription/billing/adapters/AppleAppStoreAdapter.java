package com.subscription.billing.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import com.subscription.billing.canonical.AppleVocabulary;
import com.subscription.billing.compliance.SensitiveDataMasker;
import com.subscription.billing.core.SubscriptionProvider;
import com.subscription.billing.core.exception.ConfigurationException;
import com.subscription.billing.core.exception.ProviderFetchException;
import com.subscription.billing.core.exception.VerificationException;
import com.subscription.billing.domain.ProviderType;
import com.subscription.billing.domain.ReceiptPlatform;
import com.subscription.billing.domain.ReceiptValidationResult;
import com.subscription.billing.domain.SubscriptionStatus;
import com.subscription.billing.verification.AppleSignedPayloadVerifier;
import com.subscription.billing.verification.ReceiptToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * App Store receipts through verifyReceipt. Subscriptions are managed by the user in iOS settings,
 * so create, cancel, resume and fetch keep the unsupported defaults.
 */
@Slf4j
public class AppleAppStoreAdapter implements SubscriptionProvider {

    private final String sharedSecret;
    private final String bundleId;
    private final String productionUrl;
    private final String sandboxUrl;
    private final boolean excludeOldTransactions;
    private final AppleSignedPayloadVerifier payloadVerifier;
    private final RestTemplate restTemplate;
    private final Clock clock;

    public AppleAppStoreAdapter(String sharedSecret, String bundleId, String productionUrl, String sandboxUrl,
                                boolean excludeOldTransactions, AppleSignedPayloadVerifier payloadVerifier,
                                RestTemplate restTemplate, Clock clock) {
        if (sharedSecret == null || sharedSecret.isBlank()) {
            throw new ConfigurationException("App Store shared secret is required", "APPLE_CONFIG_MISSING",
                    ProviderType.APPLE_APPSTORE);
        }
        if (!payloadVerifier.isConfigured()) {
            log.warn("Apple root certificate fingerprint is not configured; every server notification will be rejected");
        }
        this.sharedSecret = sharedSecret;
        this.bundleId = bundleId;
        this.productionUrl = productionUrl;
        this.sandboxUrl = sandboxUrl;
        this.excludeOldTransactions = excludeOldTransactions;
        this.payloadVerifier = payloadVerifier;
        this.restTemplate = restTemplate;
        this.clock = clock;
    }

    @Override
    public ProviderType getProviderType() {
        return ProviderType.APPLE_APPSTORE;
    }

    /**
     * @param receipt {@code productId:base64ReceiptData}
     */
    @Override
    public ReceiptValidationResult validateReceipt(String receipt, ReceiptPlatform platform) {
        if (platform != ReceiptPlatform.IOS) {
            throw new VerificationException("App Store only validates ios receipts", "PLATFORM_MISMATCH",
                    ProviderType.APPLE_APPSTORE);
        }
        ReceiptToken parsed = ReceiptToken.parse(receipt, ProviderType.APPLE_APPSTORE);
        log.debug("Validating App Store receipt {}", SensitiveDataMasker.maskReceipt(receipt));

        JsonNode response = post(productionUrl, parsed.getToken());
        int status = response.path("status").asInt(-1);
        if (status == AppleVocabulary.STATUS_SANDBOX_RECEIPT) {
            log.info("Sandbox receipt sent to production, retrying against sandbox");
            response = post(sandboxUrl, parsed.getToken());
            status = response.path("status").asInt(-1);
        }
        if (status != AppleVocabulary.STATUS_OK) {
            String code = "APPLE_STATUS_" + status;
            if (AppleVocabulary.isTransientStatus(status)) {
                throw new ProviderFetchException(AppleVocabulary.statusMessage(status), code, ProviderType.APPLE_APPSTORE, 503);
            }
            throw new VerificationException(AppleVocabulary.statusMessage(status), code, ProviderType.APPLE_APPSTORE);
        }

        String receiptBundle = response.path("receipt").path("bundle_id").asText(null);
        if (bundleId != null && !bundleId.isBlank() && receiptBundle != null && !bundleId.equals(receiptBundle)) {
            throw new VerificationException("Receipt belongs to another app", "APPLE_BUNDLE_MISMATCH", ProviderType.APPLE_APPSTORE);
        }

        JsonNode latest = null;
        long latestExpiry = Long.MIN_VALUE;
        for (JsonNode info : response.path("latest_receipt_info")) {
            if (!parsed.getProductId().equals(info.path("product_id").asText(null))) {
                continue;
            }
            long expiry = info.path("expires_date_ms").asLong(0);
            if (latest == null || expiry > latestExpiry) {
                latest = info;
                latestExpiry = expiry;
            }
        }
        if (latest == null) {
            throw new VerificationException("Receipt has no transaction for product " + parsed.getProductId(),
                    "APPLE_PRODUCT_NOT_FOUND", ProviderType.APPLE_APPSTORE);
        }

        String originalTransactionId = latest.path("original_transaction_id").asText(null);
        Instant expiresAt = latestExpiry > 0 ? Instant.ofEpochMilli(latestExpiry) : null;
        SubscriptionStatus subscriptionStatus = AppleVocabulary.fromReceipt(
                latest.hasNonNull("cancellation_date_ms"), expiresAt, clock.instant());

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("environment", response.path("environment").asText(null));
        if (latest.hasNonNull("cancellation_reason")) {
            metadata.put("cancellation_reason", latest.path("cancellation_reason").asText());
        }

        return ReceiptValidationResult.builder()
                .provider(ProviderType.APPLE_APPSTORE)
                .valid(subscriptionStatus == SubscriptionStatus.ACTIVE)
                .status(subscriptionStatus)
                .providerSubscriptionId(originalTransactionId)
                .productId(parsed.getProductId())
                .transactionId(latest.path("transaction_id").asText(null))
                .purchaseDate(millis(latest.path("purchase_date_ms")))
                .expiryDate(expiresAt)
                .autoRenewing(isAutoRenewing(response, originalTransactionId))
                .trial("true".equals(latest.path("is_trial_period").asText(null)))
                .introOffer("true".equals(latest.path("is_in_intro_offer_period").asText(null)))
                .metadata(metadata)
                .build();
    }

    /**
     * The body is an App Store Server Notification v2; the header is unused because the
     * signature travels inside the JWS.
     */
    @Override
    public boolean verifyWebhookSignature(String rawPayload, String signatureHeader) {
        try {
            payloadVerifier.verifyNotification(rawPayload);
            return true;
        } catch (VerificationException e) {
            log.warn("App Store notification rejected: {}", e.getMessage());
            return false;
        }
    }

    private JsonNode post(String url, String receiptData) {
        Map<String, Object> body = new HashMap<>();
        body.put("receipt-data", receiptData);
        body.put("password", sharedSecret);
        body.put("exclude-old-transactions", excludeOldTransactions);
        try {
            JsonNode response = restTemplate.postForObject(url, body, JsonNode.class);
            if (response == null) {
                throw new ProviderFetchException("verifyReceipt returned an empty body", "APPLE_VERIFY_FAILED",
                        ProviderType.APPLE_APPSTORE, 502);
            }
            return response;
        } catch (RestClientException e) {
            throw ProviderHttpErrors.translate(ProviderType.APPLE_APPSTORE, "APPLE_VERIFY_FAILED", "verifyReceipt", e);
        }
    }

    private static boolean isAutoRenewing(JsonNode response, String originalTransactionId) {
        for (JsonNode renewal : response.path("pending_renewal_info")) {
            if (originalTransactionId != null && originalTransactionId.equals(renewal.path("original_transaction_id").asText(null))) {
                return "1".equals(renewal.path("auto_renew_status").asText(null));
            }
        }
        return false;
    }

    private static Instant millis(JsonNode node) {
        long value = node.asLong(0);
        return value > 0 ? Instant.ofEpochMilli(value) : null;
    }
}
