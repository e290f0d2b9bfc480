package com.subscription.billing.core;

import com.subscription.billing.core.exception.MethodNotSupportedException;
import com.subscription.billing.domain.CreateSubscriptionParams;
import com.subscription.billing.domain.ProviderSubscriptionDetails;
import com.subscription.billing.domain.ProviderSubscriptionResponse;
import com.subscription.billing.domain.ProviderType;
import com.subscription.billing.domain.ReceiptPlatform;
import com.subscription.billing.domain.ReceiptValidationResult;

/**
 * What every subscription backend implements.
 * Takes canonical calls, talks to Razorpay / Google Play / the App Store, and gives back canonical results.
 * Operations a backend cannot perform throw {@link MethodNotSupportedException}; they never silently no-op.
 * Network failures surface as {@link com.subscription.billing.core.exception.ProviderFetchException}
 * carrying the provider HTTP status and error code.
 */
public interface SubscriptionProvider {

    ProviderType getProviderType();

    /**
     * Name of this provider implementation. Used as the circuit breaker name.
     */
    default String getProviderName() {
        return this.getClass().getSimpleName();
    }

    /**
     * Open a recurring subscription server-side.
     * @return provider id, initial status and the checkout URL when there is one
     */
    default ProviderSubscriptionResponse createSubscription(CreateSubscriptionParams params) {
        throw new MethodNotSupportedException(getProviderType(), "createSubscription");
    }

    default void cancelSubscription(String providerSubscriptionId, boolean cancelAtCycleEnd) {
        throw new MethodNotSupportedException(getProviderType(), "cancelSubscription");
    }

    default void resumeSubscription(String providerSubscriptionId) {
        throw new MethodNotSupportedException(getProviderType(), "resumeSubscription");
    }

    default ProviderSubscriptionDetails fetchSubscription(String providerSubscriptionId) {
        throw new MethodNotSupportedException(getProviderType(), "fetchSubscription");
    }

    /**
     * Validate a client-submitted receipt formatted as {@code productId:purchaseToken}.
     */
    default ReceiptValidationResult validateReceipt(String receipt, ReceiptPlatform platform) {
        throw new MethodNotSupportedException(getProviderType(), "validateReceipt");
    }

    /**
     * Authenticate an inbound notification. Never throws; false means reject.
     */
    boolean verifyWebhookSignature(String rawPayload, String signatureHeader);
}
