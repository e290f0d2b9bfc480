package com.subscription.billing.core.exception;

import com.subscription.billing.domain.ProviderType;

/**
 * Signature mismatch, unverifiable notification or malformed receipt. The event is rejected
 * and nothing is mutated.
 */
public class VerificationException extends BillingException {

    public VerificationException(String message, String code, ProviderType provider) {
        super(message, code, provider, 400);
    }

    public VerificationException(String message, String code, ProviderType provider, int httpStatus) {
        super(message, code, provider, httpStatus);
    }

    public VerificationException(String message, String code, ProviderType provider, Throwable cause) {
        super(message, code, provider, 400, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
