package com.subscription.billing.core.exception;

import com.subscription.billing.domain.ProviderType;

/**
 * The operation has no meaning for this provider (e.g. creating a store subscription server-side).
 */
public class MethodNotSupportedException extends BillingException {

    public static final String CODE = "METHOD_NOT_SUPPORTED";

    public MethodNotSupportedException(ProviderType provider, String operation) {
        super(operation + " is not supported by " + provider.getToken(), CODE, provider, 400);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
