package com.subscription.billing.canonical;

import com.subscription.billing.domain.CanonicalEventType;
import com.subscription.billing.domain.SubscriptionStatus;

import java.time.Instant;
import java.util.Arrays;
import java.util.Optional;

/**
 * Google Play Developer API vocabulary: real-time developer notification types,
 * subscriptionsv2 states and the legacy purchases.subscriptions fields.
 */
public final class GooglePlayVocabulary {

    public static final String STATE_ACTIVE = "SUBSCRIPTION_STATE_ACTIVE";
    public static final String STATE_IN_GRACE_PERIOD = "SUBSCRIPTION_STATE_IN_GRACE_PERIOD";
    public static final String STATE_ON_HOLD = "SUBSCRIPTION_STATE_ON_HOLD";
    public static final String STATE_PAUSED = "SUBSCRIPTION_STATE_PAUSED";
    public static final String STATE_CANCELED = "SUBSCRIPTION_STATE_CANCELED";
    public static final String STATE_EXPIRED = "SUBSCRIPTION_STATE_EXPIRED";
    public static final String STATE_PENDING = "SUBSCRIPTION_STATE_PENDING";
    public static final String STATE_PENDING_PURCHASE_CANCELED = "SUBSCRIPTION_STATE_PENDING_PURCHASE_CANCELED";

    /** Legacy paymentState for a subscription in its free trial. */
    public static final int PAYMENT_FREE_TRIAL = 2;

    /**
     * RTDN subscriptionNotification.notificationType codes.
     */
    public enum NotificationType {
        RECOVERED(1, CanonicalEventType.ACTIVATED, true),
        RENEWED(2, CanonicalEventType.CHARGED, true),
        CANCELED(3, CanonicalEventType.CANCELLED, false),
        PURCHASED(4, CanonicalEventType.ACTIVATED, false),
        ON_HOLD(5, CanonicalEventType.PAUSED, false),
        IN_GRACE_PERIOD(6, CanonicalEventType.PENDING, false),
        RESTARTED(7, CanonicalEventType.ACTIVATED, false),
        PRICE_CHANGE_CONFIRMED(8, CanonicalEventType.UPDATED, false),
        DEFERRED(9, CanonicalEventType.UPDATED, true),
        PAUSED(10, CanonicalEventType.PAUSED, false),
        PAUSE_SCHEDULE_CHANGED(11, CanonicalEventType.UPDATED, false),
        REVOKED(12, CanonicalEventType.CANCELLED, false),
        EXPIRED(13, CanonicalEventType.EXPIRED, false);

        private final int code;
        private final CanonicalEventType canonicalType;
        private final boolean requiresProviderFetch;

        NotificationType(int code, CanonicalEventType canonicalType, boolean requiresProviderFetch) {
            this.code = code;
            this.canonicalType = canonicalType;
            this.requiresProviderFetch = requiresProviderFetch;
        }

        public int getCode() {
            return code;
        }

        public CanonicalEventType getCanonicalType() {
            return canonicalType;
        }

        public boolean requiresProviderFetch() {
            return requiresProviderFetch;
        }

        /** Name as stored in the webhook inbox, e.g. SUBSCRIPTION_RENEWED. */
        public String eventName() {
            return "SUBSCRIPTION_" + name();
        }

        public static Optional<NotificationType> fromCode(int code) {
            return Arrays.stream(values()).filter(t -> t.code == code).findFirst();
        }
    }

    private GooglePlayVocabulary() {}

    /**
     * Canonical status for a subscriptionsv2 state. A canceled subscription keeps access
     * until its expiry, so it maps to pending_cancellation while the expiry is in the future.
     */
    public static SubscriptionStatus fromSubscriptionState(String state, Instant expiry, Instant now) {
        if (state == null) {
            return SubscriptionStatus.CREATED;
        }
        switch (state) {
            case STATE_ACTIVE:
            case STATE_IN_GRACE_PERIOD:
                return SubscriptionStatus.ACTIVE;
            case STATE_ON_HOLD:
            case STATE_PAUSED:
                return SubscriptionStatus.PAUSED;
            case STATE_CANCELED:
                return expiry != null && expiry.isAfter(now)
                        ? SubscriptionStatus.PENDING_CANCELLATION
                        : SubscriptionStatus.EXPIRED;
            case STATE_EXPIRED:
                return SubscriptionStatus.EXPIRED;
            case STATE_PENDING_PURCHASE_CANCELED:
                return SubscriptionStatus.CANCELLED;
            case STATE_PENDING:
            default:
                return SubscriptionStatus.CREATED;
        }
    }

    /**
     * Canonical status for a legacy purchases.subscriptions resource. Payment states 0
     * (grace period), 1 (received), 2 (trial) and 3 (deferred) all keep access until expiry.
     */
    public static SubscriptionStatus fromLegacyPurchase(Integer paymentState, Instant expiry,
                                                        boolean hasCancelReason, Instant now) {
        if (expiry == null || !expiry.isAfter(now)) {
            return SubscriptionStatus.EXPIRED;
        }
        if (hasCancelReason) {
            return SubscriptionStatus.PENDING_CANCELLATION;
        }
        if (paymentState == null) {
            return SubscriptionStatus.CREATED;
        }
        return SubscriptionStatus.ACTIVE;
    }
}
