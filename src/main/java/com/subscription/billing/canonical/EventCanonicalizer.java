package com.subscription.billing.canonical;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.subscription.billing.core.exception.VerificationException;
import com.subscription.billing.domain.CanonicalEvent;
import com.subscription.billing.domain.CanonicalEventType;
import com.subscription.billing.domain.InvoiceStatus;
import com.subscription.billing.domain.PaymentSnapshot;
import com.subscription.billing.domain.ProviderSubscriptionDetails;
import com.subscription.billing.domain.ProviderType;
import com.subscription.billing.domain.ReceiptValidationResult;
import com.subscription.billing.domain.SubscriptionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Turns provider payloads into {@link CanonicalEvent}s. Malformed payloads are rejected with
 * {@link VerificationException}; well-formed events that carry no subscription meaning map to empty.
 */
@Slf4j
@Component
public class EventCanonicalizer {

    public static final String INVALID_PAYLOAD = "INVALID_PAYLOAD";
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() {};

    private final ObjectMapper objectMapper;
    private final String googlePlayPackageName;
    private final String appleBundleId;

    public EventCanonicalizer(ObjectMapper objectMapper,
                              @Value("${billing.google-play.package-name:}") String googlePlayPackageName,
                              @Value("${billing.apple.bundle-id:}") String appleBundleId) {
        this.objectMapper = objectMapper;
        this.googlePlayPackageName = googlePlayPackageName;
        this.appleBundleId = appleBundleId;
    }

    // ---- Razorpay ----

    /**
     * @param rawPayload verified webhook body
     * @param eventId value of the X-Razorpay-Event-Id header, may be null
     */
    public Optional<CanonicalEvent> fromRazorpayWebhook(String rawPayload, String eventId) {
        JsonNode root = readTree(rawPayload, ProviderType.RAZORPAY);
        String eventName = root.path("event").asText(null);
        if (eventName == null) {
            throw invalid(ProviderType.RAZORPAY, "missing event name");
        }
        Optional<CanonicalEventType> type = RazorpayVocabulary.toEventType(eventName);
        if (type.isEmpty()) {
            log.debug("Razorpay event {} carries no subscription transition", eventName);
            return Optional.empty();
        }

        JsonNode subscription = root.path("payload").path("subscription").path("entity");
        String subscriptionId = subscription.path("id").asText(null);
        if (subscriptionId == null || subscriptionId.isBlank()) {
            throw invalid(ProviderType.RAZORPAY, "missing payload.subscription.entity.id");
        }

        CanonicalEvent.CanonicalEventBuilder builder = CanonicalEvent.builder()
                .provider(ProviderType.RAZORPAY)
                .type(type.get())
                .providerSubscriptionId(subscriptionId)
                .providerEventId(eventId)
                .nativeEventType(eventName)
                .occurredAt(epochSeconds(root.path("created_at")))
                .providerStatus(RazorpayVocabulary.toStatus(subscription.path("status").asText(null)).orElse(null))
                .providerPlanId(subscription.path("plan_id").asText(null))
                .periodStart(epochSeconds(subscription.path("current_start")))
                .periodEnd(epochSeconds(subscription.path("current_end")))
                .nextBillingAt(epochSeconds(subscription.path("charge_at")))
                .totalCount(intOrNull(subscription.path("total_count")))
                .paidCount(intOrNull(subscription.path("paid_count")))
                .remainingCount(intOrNull(subscription.path("remaining_count")))
                .payload(toMap(subscription));

        if (type.get() == CanonicalEventType.CANCELLED) {
            builder.cancelAtCycleEnd(false).cancellationReason("provider_cancelled");
        }

        JsonNode payment = root.path("payload").path("payment").path("entity");
        if (!payment.isMissingNode() && payment.hasNonNull("id")) {
            InvoiceStatus status = RazorpayVocabulary.toInvoiceStatus(payment.path("status").asText(null));
            builder.payment(PaymentSnapshot.builder()
                    .paymentId(payment.path("id").asText())
                    .amount(payment.hasNonNull("amount") ? payment.path("amount").asLong() : null)
                    .currency(payment.path("currency").asText(null))
                    .status(status)
                    .method(payment.path("method").asText(null))
                    .paidAt(status == InvoiceStatus.PAID ? epochSeconds(payment.path("created_at")) : null)
                    .build());
        }
        return Optional.of(builder.build());
    }

    // ---- Google Play ----

    /**
     * Decodes a Pub/Sub push envelope {@code {message: {data, messageId}, subscription}}.
     */
    public PubSubMessage decodePubSubPush(String rawBody) {
        JsonNode root = readTree(rawBody, ProviderType.GOOGLE_PLAY);
        JsonNode message = root.path("message");
        String messageId = message.path("messageId").asText(message.path("message_id").asText(null));
        String data = message.path("data").asText(null);
        if (messageId == null || data == null) {
            throw invalid(ProviderType.GOOGLE_PLAY, "push envelope lacks message.data or message.messageId");
        }
        String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(data), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw invalid(ProviderType.GOOGLE_PLAY, "message.data is not base64");
        }
        return new PubSubMessage(messageId, readTree(decoded, ProviderType.GOOGLE_PLAY));
    }

    /**
     * Canonical event for a developer notification. Test and one-time-product notifications map to empty.
     */
    public Optional<CanonicalEvent> fromGooglePlayNotification(JsonNode notification, String messageId) {
        String packageName = notification.path("packageName").asText(null);
        if (googlePlayPackageName != null && !googlePlayPackageName.isBlank() && !googlePlayPackageName.equals(packageName)) {
            throw new VerificationException("Notification is for another package", "GOOGLE_PLAY_PACKAGE_MISMATCH",
                    ProviderType.GOOGLE_PLAY);
        }
        if (notification.has("testNotification")) {
            log.info("Google Play test notification {} received", messageId);
            return Optional.empty();
        }
        JsonNode sub = notification.path("subscriptionNotification");
        if (sub.isMissingNode()) {
            log.debug("Google Play notification {} is not about a subscription", messageId);
            return Optional.empty();
        }
        String purchaseToken = sub.path("purchaseToken").asText(null);
        if (purchaseToken == null || purchaseToken.isBlank()) {
            throw invalid(ProviderType.GOOGLE_PLAY, "subscriptionNotification.purchaseToken missing");
        }
        int code = sub.path("notificationType").asInt(-1);
        Optional<GooglePlayVocabulary.NotificationType> type = GooglePlayVocabulary.NotificationType.fromCode(code);
        if (type.isEmpty()) {
            log.warn("Unknown Google Play notification type {} in message {}", code, messageId);
            return Optional.empty();
        }

        GooglePlayVocabulary.NotificationType nt = type.get();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("notification_type", nt.eventName());
        payload.put("product_id", sub.path("subscriptionId").asText(null));

        CanonicalEvent.CanonicalEventBuilder builder = CanonicalEvent.builder()
                .provider(ProviderType.GOOGLE_PLAY)
                .type(nt.getCanonicalType())
                .providerSubscriptionId(purchaseToken)
                .providerEventId(messageId)
                .nativeEventType(nt.eventName())
                .occurredAt(epochMillis(notification.path("eventTimeMillis")))
                .requiresProviderFetch(nt.requiresProviderFetch())
                .payload(payload);

        switch (nt) {
            case CANCELED:
                builder.cancelAtCycleEnd(true).cancellationReason("user_canceled");
                break;
            case REVOKED:
                builder.cancelAtCycleEnd(false).cancellationReason("refunded");
                break;
            case EXPIRED:
                builder.providerStatus(SubscriptionStatus.EXPIRED);
                break;
            case ON_HOLD:
                builder.cancellationReason("account_hold");
                break;
            default:
                break;
        }
        return Optional.of(builder.build());
    }

    // ---- App Store ----

    /**
     * @param notification verified signedPayload claims
     * @param transaction verified signedTransactionInfo claims
     */
    public Optional<CanonicalEvent> fromAppleNotification(Map<String, Object> notification, Map<String, Object> transaction) {
        JsonNode root = objectMapper.valueToTree(notification);
        JsonNode tx = objectMapper.valueToTree(transaction);
        String notificationType = root.path("notificationType").asText(null);
        String subtype = root.path("subtype").asText(null);

        String bundleId = root.path("data").path("bundleId").asText(null);
        if (appleBundleId != null && !appleBundleId.isBlank() && !appleBundleId.equals(bundleId)) {
            throw new VerificationException("Notification is for another bundle", "APPLE_BUNDLE_MISMATCH",
                    ProviderType.APPLE_APPSTORE);
        }

        Optional<AppleVocabulary.NotificationMapping> mapping = AppleVocabulary.map(notificationType, subtype);
        if (mapping.isEmpty()) {
            log.info("App Store notification {}/{} carries no subscription transition", notificationType, subtype);
            return Optional.empty();
        }
        String originalTransactionId = tx.path("originalTransactionId").asText(null);
        if (originalTransactionId == null || originalTransactionId.isBlank()) {
            throw invalid(ProviderType.APPLE_APPSTORE, "signedTransactionInfo.originalTransactionId missing");
        }

        AppleVocabulary.NotificationMapping m = mapping.get();
        Instant expires = epochMillis(tx.path("expiresDate"));
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("notification_type", notificationType);
        payload.put("subtype", subtype);
        payload.put("product_id", tx.path("productId").asText(null));
        payload.put("transaction_id", tx.path("transactionId").asText(null));
        payload.put("environment", root.path("data").path("environment").asText(null));

        CanonicalEvent.CanonicalEventBuilder builder = CanonicalEvent.builder()
                .provider(ProviderType.APPLE_APPSTORE)
                .type(m.getType())
                .providerSubscriptionId(originalTransactionId)
                .providerEventId(root.path("notificationUUID").asText(null))
                .nativeEventType(subtype != null ? notificationType + "/" + subtype : notificationType)
                .occurredAt(epochMillis(root.path("signedDate")))
                .providerStatus(m.getProviderStatus())
                .cancelAtCycleEnd(m.getCancelAtCycleEnd())
                .cancellationReason(m.getReason())
                .providerPlanId(tx.path("productId").asText(null))
                .periodStart(epochMillis(tx.path("purchaseDate")))
                .periodEnd(expires)
                .payload(payload);

        if (m.getType() == CanonicalEventType.CHARGED || m.getType() == CanonicalEventType.ACTIVATED) {
            builder.nextBillingAt(expires);
        }
        if (m.getType() == CanonicalEventType.CHARGED && tx.hasNonNull("transactionId")) {
            builder.payment(PaymentSnapshot.builder()
                    .paymentId(tx.path("transactionId").asText())
                    // price is reported in milliunits
                    .amount(tx.hasNonNull("price") ? tx.path("price").asLong() / 10 : null)
                    .currency(tx.path("currency").asText(null))
                    .status(InvoiceStatus.PAID)
                    .method("app_store")
                    .paidAt(epochMillis(tx.path("purchaseDate")))
                    .build());
        }
        return Optional.of(builder.build());
    }

    // ---- Provider truth ----

    /**
     * An {@code updated} event carrying what a provider fetch returned.
     */
    public CanonicalEvent fromProviderDetails(ProviderSubscriptionDetails details, Instant fetchedAt, String reason) {
        return CanonicalEvent.builder()
                .provider(details.getProvider())
                .type(CanonicalEventType.UPDATED)
                .providerSubscriptionId(details.getProviderSubscriptionId())
                .nativeEventType(reason)
                .occurredAt(fetchedAt)
                .providerStatus(details.getStatus())
                .providerPlanId(details.getPlanId())
                .periodStart(details.getCurrentPeriodStart())
                .periodEnd(details.getCurrentPeriodEnd())
                .nextBillingAt(details.getNextBillingAt())
                .totalCount(details.getTotalCount())
                .paidCount(details.getPaidCount())
                .remainingCount(details.getRemainingCount())
                .payload(details.getMetadata())
                .build();
    }

    /**
     * Event for a validated store receipt. The transaction id makes a resubmitted receipt a duplicate.
     */
    public CanonicalEvent fromReceipt(ReceiptValidationResult result, CanonicalEventType type, Instant receivedAt) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("product_id", result.getProductId());
        payload.put("auto_renewing", result.isAutoRenewing());
        payload.put("trial", result.isTrial());
        payload.put("intro_offer", result.isIntroOffer());
        return CanonicalEvent.builder()
                .provider(result.getProvider())
                .type(type)
                .providerSubscriptionId(result.getProviderSubscriptionId())
                .providerEventId(result.getTransactionId() != null ? "receipt:" + result.getTransactionId() : null)
                .nativeEventType("receipt")
                .occurredAt(receivedAt)
                .providerStatus(result.getStatus())
                .providerPlanId(result.getProductId())
                .periodStart(result.getPurchaseDate())
                .periodEnd(result.getExpiryDate())
                .nextBillingAt(result.isAutoRenewing() ? result.getExpiryDate() : null)
                .cancelAtCycleEnd(result.isAutoRenewing() ? null : Boolean.TRUE)
                .payload(payload)
                .build();
    }

    private JsonNode readTree(String raw, ProviderType provider) {
        if (raw == null || raw.isBlank()) {
            throw invalid(provider, "empty body");
        }
        try {
            JsonNode node = objectMapper.readTree(raw);
            if (node == null || !node.isObject()) {
                throw invalid(provider, "body is not a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw invalid(provider, "body is not valid JSON");
        }
    }

    private Map<String, Object> toMap(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        return objectMapper.convertValue(node, MAP_TYPE);
    }

    private static VerificationException invalid(ProviderType provider, String reason) {
        return new VerificationException("Malformed " + provider.getToken() + " payload: " + reason, INVALID_PAYLOAD, provider);
    }

    static Instant epochSeconds(JsonNode node) {
        Long value = longOrNull(node);
        return value != null && value > 0 ? Instant.ofEpochSecond(value) : null;
    }

    static Instant epochMillis(JsonNode node) {
        Long value = longOrNull(node);
        return value != null && value > 0 ? Instant.ofEpochMilli(value) : null;
    }

    private static Long longOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asLong();
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Integer intOrNull(JsonNode node) {
        Long value = longOrNull(node);
        return value != null ? value.intValue() : null;
    }
}
