package com.subscription.billing.canonical;

import com.subscription.billing.domain.CanonicalEventType;
import com.subscription.billing.domain.SubscriptionStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * App Store vocabulary: verifyReceipt status codes and Server Notification v2 types.
 */
public final class AppleVocabulary {

    public static final int STATUS_OK = 0;
    public static final int STATUS_SANDBOX_RECEIPT = 21007;

    private static final Map<Integer, String> STATUS_MESSAGES = Map.of(
            21000, "App Store could not read the receipt",
            21002, "Receipt data is malformed",
            21003, "Receipt could not be authenticated",
            21004, "Shared secret does not match",
            21005, "Receipt server is unavailable",
            21006, "Receipt is valid but subscription has expired",
            21007, "Sandbox receipt sent to production",
            21008, "Production receipt sent to sandbox",
            21009, "Internal data access error",
            21010, "User account not found or deleted");

    private static final Set<Integer> TRANSIENT_STATUSES = Set.of(21005, 21009);

    private static final Set<String> METADATA_ONLY = Set.of(
            "DID_CHANGE_RENEWAL_PREF", "PRICE_INCREASE", "RENEWAL_EXTENDED", "RENEWAL_EXTENSION",
            "REFUND_DECLINED", "OFFER_REDEEMED");

    /**
     * Canonical reading of one notification type / subtype pair.
     */
    @Value
    @Builder
    public static class NotificationMapping {
        CanonicalEventType type;
        Boolean cancelAtCycleEnd;
        SubscriptionStatus providerStatus;
        String reason;
    }

    private AppleVocabulary() {}

    public static String statusMessage(int status) {
        return STATUS_MESSAGES.getOrDefault(status, "Apple validation failed with status " + status);
    }

    /** 21005 / 21009 and the 211xx internal range are worth retrying. */
    public static boolean isTransientStatus(int status) {
        return TRANSIENT_STATUSES.contains(status) || (status >= 21100 && status <= 21199);
    }

    /**
     * Receipt status: a cancellation date wins, then expiry against now.
     */
    public static SubscriptionStatus fromReceipt(boolean hasCancellationDate, Instant expiresAt, Instant now) {
        if (hasCancellationDate) {
            return SubscriptionStatus.CANCELLED;
        }
        if (expiresAt == null || expiresAt.isBefore(now)) {
            return SubscriptionStatus.EXPIRED;
        }
        return SubscriptionStatus.ACTIVE;
    }

    public static Optional<NotificationMapping> map(String notificationType, String subtype) {
        if (notificationType == null) {
            return Optional.empty();
        }
        switch (notificationType) {
            case "SUBSCRIBED":
                return Optional.of(NotificationMapping.builder().type(CanonicalEventType.ACTIVATED).build());
            case "DID_RENEW":
                return Optional.of(NotificationMapping.builder().type(CanonicalEventType.CHARGED).build());
            case "DID_FAIL_TO_RENEW":
                if ("GRACE_PERIOD".equals(subtype)) {
                    return Optional.of(NotificationMapping.builder().type(CanonicalEventType.PENDING).build());
                }
                return Optional.of(NotificationMapping.builder()
                        .type(CanonicalEventType.PAUSED)
                        .reason("billing_retry")
                        .build());
            case "DID_CHANGE_RENEWAL_STATUS":
                if ("AUTO_RENEW_DISABLED".equals(subtype)) {
                    return Optional.of(NotificationMapping.builder()
                            .type(CanonicalEventType.CANCELLED)
                            .cancelAtCycleEnd(true)
                            .reason("auto_renew_disabled")
                            .build());
                }
                if ("AUTO_RENEW_ENABLED".equals(subtype)) {
                    return Optional.of(NotificationMapping.builder().type(CanonicalEventType.ACTIVATED).build());
                }
                return Optional.empty();
            case "EXPIRED":
            case "GRACE_PERIOD_EXPIRED":
                return Optional.of(NotificationMapping.builder()
                        .type(CanonicalEventType.EXPIRED)
                        .providerStatus(SubscriptionStatus.EXPIRED)
                        .build());
            case "REFUND":
            case "REVOKE":
                return Optional.of(NotificationMapping.builder()
                        .type(CanonicalEventType.CANCELLED)
                        .cancelAtCycleEnd(false)
                        .reason("REFUND".equals(notificationType) ? "refunded" : "revoked")
                        .build());
            default:
                if (METADATA_ONLY.contains(notificationType)) {
                    return Optional.of(NotificationMapping.builder().type(CanonicalEventType.UPDATED).build());
                }
                return Optional.empty();
        }
    }
}
