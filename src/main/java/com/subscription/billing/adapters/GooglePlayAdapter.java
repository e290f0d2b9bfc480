package com.subscription.billing.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import com.subscription.billing.canonical.GooglePlayVocabulary;
import com.subscription.billing.compliance.SensitiveDataMasker;
import com.subscription.billing.core.SubscriptionProvider;
import com.subscription.billing.core.exception.ConfigurationException;
import com.subscription.billing.core.exception.MethodNotSupportedException;
import com.subscription.billing.core.exception.ProviderFetchException;
import com.subscription.billing.core.exception.VerificationException;
import com.subscription.billing.domain.ProviderSubscriptionDetails;
import com.subscription.billing.domain.ProviderType;
import com.subscription.billing.domain.ReceiptPlatform;
import com.subscription.billing.domain.ReceiptValidationResult;
import com.subscription.billing.domain.SubscriptionStatus;
import com.subscription.billing.verification.GooglePlayAccessTokenProvider;
import com.subscription.billing.verification.ReceiptToken;
import com.subscription.billing.verification.WebhookSignatureVerifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Google Play Developer API. Subscriptions are bought in the Play Store, so create and resume are
 * not supported and cancel only stops renewal at the end of the current period.
 */
@Slf4j
public class GooglePlayAdapter implements SubscriptionProvider {

    private final String packageName;
    private final GooglePlayAccessTokenProvider tokenProvider;
    private final String rtdnToken;
    private final boolean useLegacyApi;
    private final String baseUrl;
    private final RestTemplate restTemplate;
    private final Clock clock;

    public GooglePlayAdapter(String packageName, GooglePlayAccessTokenProvider tokenProvider, String rtdnToken,
                             boolean useLegacyApi, String baseUrl, RestTemplate restTemplate, Clock clock) {
        if (packageName == null || packageName.isBlank()) {
            throw new ConfigurationException("Google Play package name is required", "GOOGLE_PLAY_CONFIG_MISSING",
                    ProviderType.GOOGLE_PLAY);
        }
        if (rtdnToken == null || rtdnToken.isBlank()) {
            log.warn("Google Play push token is not configured; every real-time notification will be rejected");
        }
        this.packageName = packageName;
        this.tokenProvider = tokenProvider;
        this.rtdnToken = rtdnToken;
        this.useLegacyApi = useLegacyApi;
        this.baseUrl = baseUrl;
        this.restTemplate = restTemplate;
        this.clock = clock;
    }

    @Override
    public ProviderType getProviderType() {
        return ProviderType.GOOGLE_PLAY;
    }

    @Override
    public ReceiptValidationResult validateReceipt(String receipt, ReceiptPlatform platform) {
        if (platform != ReceiptPlatform.ANDROID) {
            throw new VerificationException("Google Play only validates android receipts", "PLATFORM_MISMATCH",
                    ProviderType.GOOGLE_PLAY);
        }
        ReceiptToken parsed = ReceiptToken.parse(receipt, ProviderType.GOOGLE_PLAY);
        log.debug("Validating Google Play receipt {}", SensitiveDataMasker.maskReceipt(receipt));
        return useLegacyApi
                ? validateLegacy(parsed)
                : validateV2(parsed);
    }

    @Override
    public ProviderSubscriptionDetails fetchSubscription(String purchaseToken) {
        JsonNode purchase = getSubscriptionV2(purchaseToken);
        JsonNode lineItem = purchase.path("lineItems").path(0);
        Instant expiry = parseTime(lineItem.path("expiryTime"));
        SubscriptionStatus status = GooglePlayVocabulary.fromSubscriptionState(
                purchase.path("subscriptionState").asText(null), expiry, clock.instant());

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("subscription_state", purchase.path("subscriptionState").asText(null));
        metadata.put("latest_order_id", purchase.path("latestOrderId").asText(null));
        return ProviderSubscriptionDetails.builder()
                .provider(ProviderType.GOOGLE_PLAY)
                .providerSubscriptionId(purchaseToken)
                .status(status)
                .planId(lineItem.path("productId").asText(null))
                .currentPeriodStart(parseTime(purchase.path("startTime")))
                .currentPeriodEnd(expiry)
                .nextBillingAt(isAutoRenewing(purchase, lineItem) ? expiry : null)
                .autoRenewing(isAutoRenewing(purchase, lineItem))
                .metadata(metadata)
                .build();
    }

    /**
     * Only cancellation at period end exists: the user keeps access until expiry.
     */
    @Override
    public void cancelSubscription(String purchaseToken, boolean cancelAtCycleEnd) {
        if (!cancelAtCycleEnd) {
            throw new MethodNotSupportedException(ProviderType.GOOGLE_PLAY, "immediate cancelSubscription");
        }
        String productId = getSubscriptionV2(purchaseToken).path("lineItems").path(0).path("productId").asText(null);
        if (productId == null) {
            throw new ProviderFetchException("Google Play purchase has no line item", "GOOGLE_PLAY_CANCEL_FAILED",
                    ProviderType.GOOGLE_PLAY, 502);
        }
        call(HttpMethod.POST, "/applications/" + packageName + "/purchases/subscriptions/" + productId
                + "/tokens/" + purchaseToken + ":cancel", "GOOGLE_PLAY_CANCEL_FAILED", "cancel", false);
        log.info("Cancelled Google Play subscription {} at period end", SensitiveDataMasker.maskToken(purchaseToken));
    }

    /**
     * Real-time notifications arrive through a Pub/Sub push subscription whose endpoint carries a
     * shared token; that token is the signature.
     */
    @Override
    public boolean verifyWebhookSignature(String rawPayload, String pushToken) {
        if (rtdnToken == null || rtdnToken.isBlank()) {
            return false;
        }
        return WebhookSignatureVerifier.constantTimeEquals(rtdnToken, pushToken);
    }

    private ReceiptValidationResult validateV2(ReceiptToken receipt) {
        JsonNode purchase = getSubscriptionV2(receipt.getToken());
        JsonNode lineItem = null;
        for (JsonNode item : purchase.path("lineItems")) {
            if (receipt.getProductId().equals(item.path("productId").asText(null))) {
                lineItem = item;
                break;
            }
        }
        if (lineItem == null) {
            throw new VerificationException("Purchase token does not belong to product " + receipt.getProductId(),
                    "GOOGLE_PLAY_PRODUCT_MISMATCH", ProviderType.GOOGLE_PLAY);
        }

        Instant now = clock.instant();
        Instant expiry = parseTime(lineItem.path("expiryTime"));
        String state = purchase.path("subscriptionState").asText(null);
        SubscriptionStatus status = GooglePlayVocabulary.fromSubscriptionState(state, expiry, now);
        JsonNode offer = lineItem.path("offerDetails");
        boolean trial = hasOfferMarker(offer, "trial");
        boolean intro = !trial && (hasOfferMarker(offer, "intro") || offer.hasNonNull("offerId"));

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("subscription_state", state);
        metadata.put("acknowledgement_state", purchase.path("acknowledgementState").asText(null));
        if (purchase.hasNonNull("linkedPurchaseToken")) {
            metadata.put("linked_purchase_token", purchase.path("linkedPurchaseToken").asText());
        }

        return ReceiptValidationResult.builder()
                .provider(ProviderType.GOOGLE_PLAY)
                .valid(status.grantsAccess())
                .status(status)
                .providerSubscriptionId(receipt.getToken())
                .productId(receipt.getProductId())
                .transactionId(purchase.path("latestOrderId").asText(null))
                .purchaseDate(parseTime(purchase.path("startTime")))
                .expiryDate(expiry)
                .autoRenewing(isAutoRenewing(purchase, lineItem))
                .trial(trial)
                .introOffer(intro)
                .metadata(metadata)
                .build();
    }

    private ReceiptValidationResult validateLegacy(ReceiptToken receipt) {
        JsonNode purchase = call(HttpMethod.GET, "/applications/" + packageName + "/purchases/subscriptions/"
                + receipt.getProductId() + "/tokens/" + receipt.getToken(), "GOOGLE_PLAY_FETCH_FAILED", "validate", true);

        Instant now = clock.instant();
        Instant expiry = epochMillis(purchase.path("expiryTimeMillis"));
        Integer paymentState = purchase.hasNonNull("paymentState") ? purchase.path("paymentState").asInt() : null;
        boolean cancelled = purchase.hasNonNull("cancelReason");
        SubscriptionStatus status = GooglePlayVocabulary.fromLegacyPurchase(paymentState, expiry, cancelled, now);

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("payment_state", paymentState);
        if (cancelled) {
            metadata.put("cancel_reason", purchase.path("cancelReason").asInt());
        }
        if (purchase.hasNonNull("priceAmountMicros")) {
            metadata.put("price_amount_micros", purchase.path("priceAmountMicros").asText());
            metadata.put("price_currency_code", purchase.path("priceCurrencyCode").asText(null));
        }

        return ReceiptValidationResult.builder()
                .provider(ProviderType.GOOGLE_PLAY)
                .valid(status.grantsAccess())
                .status(status)
                .providerSubscriptionId(receipt.getToken())
                .productId(receipt.getProductId())
                .transactionId(purchase.path("orderId").asText(null))
                .purchaseDate(epochMillis(purchase.path("startTimeMillis")))
                .expiryDate(expiry)
                .autoRenewing(purchase.path("autoRenewing").asBoolean(false))
                .trial(paymentState != null && paymentState == GooglePlayVocabulary.PAYMENT_FREE_TRIAL)
                .introOffer(purchase.has("introductoryPriceInfo"))
                .metadata(metadata)
                .build();
    }

    private JsonNode getSubscriptionV2(String purchaseToken) {
        return call(HttpMethod.GET, "/applications/" + packageName + "/purchases/subscriptionsv2/tokens/" + purchaseToken,
                "GOOGLE_PLAY_FETCH_FAILED", "fetch", true);
    }

    private JsonNode call(HttpMethod method, String path, String errorCode, String operation, boolean expectBody) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(tokenProvider.getAccessToken());
        try {
            JsonNode body = restTemplate.exchange(baseUrl + path, method, new HttpEntity<>(headers), JsonNode.class).getBody();
            if (expectBody && body == null) {
                throw new ProviderFetchException("Google Play " + operation + " returned an empty body", errorCode,
                        ProviderType.GOOGLE_PLAY, 502);
            }
            return body;
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            if (status == 401) {
                tokenProvider.invalidate();
            }
            if (status == 404 || status == 410) {
                throw new VerificationException("Purchase token is unknown or no longer valid", "GOOGLE_PLAY_PURCHASE_NOT_FOUND",
                        ProviderType.GOOGLE_PLAY);
            }
            throw ProviderHttpErrors.translate(ProviderType.GOOGLE_PLAY, errorCode, operation, e);
        } catch (RestClientException e) {
            throw ProviderHttpErrors.translate(ProviderType.GOOGLE_PLAY, errorCode, operation, e);
        }
    }

    private static boolean isAutoRenewing(JsonNode purchase, JsonNode lineItem) {
        if (purchase.has("canceledStateContext")) {
            return false;
        }
        JsonNode plan = lineItem.path("autoRenewingPlan");
        return plan.isMissingNode() || plan.path("autoRenewEnabled").asBoolean(true);
    }

    private static boolean hasOfferMarker(JsonNode offer, String marker) {
        for (JsonNode tag : offer.path("offerTags")) {
            if (tag.asText("").toLowerCase(Locale.ROOT).contains(marker)) {
                return true;
            }
        }
        return offer.path("offerId").asText("").toLowerCase(Locale.ROOT).contains(marker);
    }

    private static Instant parseTime(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return null;
        }
        try {
            return Instant.parse(node.asText());
        } catch (DateTimeParseException e) {
            log.warn("Unparseable Google Play timestamp {}", node.asText());
            return null;
        }
    }

    private static Instant epochMillis(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        try {
            long value = node.isNumber() ? node.asLong() : Long.parseLong(node.asText());
            return value > 0 ? Instant.ofEpochMilli(value) : null;
        } catch (NumberFormatException e) {
            log.warn("Unparseable Google Play millis {}", node.asText());
            return null;
        }
    }
}
