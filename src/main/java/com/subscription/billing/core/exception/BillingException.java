package com.subscription.billing.core.exception;

import com.subscription.billing.domain.ProviderType;

/**
 * Base of the billing error taxonomy. Every subtype carries a stable code for API clients,
 * the provider involved (if any), an HTTP status hint and whether retrying can help.
 */
public abstract class BillingException extends RuntimeException {

    private final String code;
    private final ProviderType provider;
    private final int httpStatus;

    protected BillingException(String message, String code, ProviderType provider, int httpStatus) {
        super(message);
        this.code = code;
        this.provider = provider;
        this.httpStatus = httpStatus;
    }

    protected BillingException(String message, String code, ProviderType provider, int httpStatus, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.provider = provider;
        this.httpStatus = httpStatus;
    }

    public String getCode() {
        return code;
    }

    public ProviderType getProvider() {
        return provider;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public abstract boolean isRetryable();
}
