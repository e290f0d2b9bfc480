package com.subscription.billing.core.exception;

/**
 * User-facing subscription management failure with a stable business code.
 */
public class SubscriptionOperationException extends BillingException {

    public static final String NOT_FOUND = "SUBSCRIPTION_NOT_FOUND";
    public static final String ALREADY_EXISTS = "SUBSCRIPTION_ALREADY_EXISTS";
    public static final String ALREADY_CANCELLED = "SUBSCRIPTION_ALREADY_CANCELLED";
    public static final String NOT_PENDING_CANCELLATION = "SUBSCRIPTION_NOT_PENDING_CANCELLATION";
    public static final String EXPIRED = "SUBSCRIPTION_EXPIRED";
    public static final String PLAN_NOT_FOUND = "PLAN_NOT_FOUND";
    public static final String INVALID_PROVIDER = "INVALID_PROVIDER";

    public SubscriptionOperationException(String message, String code, int httpStatus) {
        super(message, code, null, httpStatus);
    }

    public static SubscriptionOperationException notFound(String subscriptionId) {
        return new SubscriptionOperationException("Subscription not found: " + subscriptionId, NOT_FOUND, 404);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
