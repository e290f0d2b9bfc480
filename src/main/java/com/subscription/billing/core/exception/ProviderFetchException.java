package com.subscription.billing.core.exception;

import com.subscription.billing.domain.ProviderType;

/**
 * The provider API call failed. 5xx, 429 and I/O failures (timeouts included) are transient;
 * other 4xx responses are permanent for the request that produced them.
 */
public class ProviderFetchException extends BillingException {

    private final boolean retryable;

    public ProviderFetchException(String message, String code, ProviderType provider, int httpStatus) {
        super(message, code, provider, httpStatus);
        this.retryable = isTransientStatus(httpStatus);
    }

    public ProviderFetchException(String message, String code, ProviderType provider, int httpStatus, Throwable cause) {
        super(message, code, provider, httpStatus, cause);
        this.retryable = isTransientStatus(httpStatus);
    }

    @Override
    public boolean isRetryable() {
        return retryable;
    }

    static boolean isTransientStatus(int httpStatus) {
        return httpStatus >= 500 || httpStatus == 429 || httpStatus == 408 || httpStatus == 0;
    }
}
