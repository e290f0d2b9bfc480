package com.subscription.billing.canonical;

import com.subscription.billing.domain.CanonicalEventType;
import com.subscription.billing.domain.InvoiceStatus;
import com.subscription.billing.domain.SubscriptionStatus;

import java.util.Map;
import java.util.Optional;

/**
 * Razorpay subscription statuses and webhook event names in canonical terms.
 */
public final class RazorpayVocabulary {

    public static final String SUBSCRIPTION_EVENT_PREFIX = "subscription.";

    private static final Map<String, SubscriptionStatus> STATUS = Map.of(
            "created", SubscriptionStatus.CREATED,
            "authenticated", SubscriptionStatus.AUTHENTICATED,
            "active", SubscriptionStatus.ACTIVE,
            "paused", SubscriptionStatus.PAUSED,
            "halted", SubscriptionStatus.PAUSED,
            "cancelled", SubscriptionStatus.CANCELLED,
            "completed", SubscriptionStatus.COMPLETED,
            "expired", SubscriptionStatus.EXPIRED,
            "pending", SubscriptionStatus.CREATED);

    private static final Map<String, CanonicalEventType> EVENTS = Map.of(
            "authenticated", CanonicalEventType.AUTHENTICATED,
            "activated", CanonicalEventType.ACTIVATED,
            "charged", CanonicalEventType.CHARGED,
            "completed", CanonicalEventType.COMPLETED,
            "updated", CanonicalEventType.UPDATED,
            "pending", CanonicalEventType.PENDING,
            "halted", CanonicalEventType.PAUSED,
            "cancelled", CanonicalEventType.CANCELLED,
            "paused", CanonicalEventType.PAUSED,
            "resumed", CanonicalEventType.RESUMED);

    private RazorpayVocabulary() {}

    public static Optional<SubscriptionStatus> toStatus(String razorpayStatus) {
        if (razorpayStatus == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(STATUS.get(razorpayStatus.toLowerCase()));
    }

    /** "subscription.charged" -> CHARGED. Non-subscription events map to empty. */
    public static Optional<CanonicalEventType> toEventType(String webhookEvent) {
        if (webhookEvent == null || !webhookEvent.startsWith(SUBSCRIPTION_EVENT_PREFIX)) {
            return Optional.empty();
        }
        return Optional.ofNullable(EVENTS.get(webhookEvent.substring(SUBSCRIPTION_EVENT_PREFIX.length())));
    }

    public static InvoiceStatus toInvoiceStatus(String paymentStatus) {
        if (paymentStatus == null) {
            return InvoiceStatus.PENDING;
        }
        switch (paymentStatus) {
            case "captured":
                return InvoiceStatus.PAID;
            case "failed":
                return InvoiceStatus.FAILED;
            case "refunded":
                return InvoiceStatus.REFUNDED;
            default:
                return InvoiceStatus.PENDING;
        }
    }
}
