package com.subscription.billing.core.exception;

import com.subscription.billing.domain.ProviderType;

/**
 * Missing or invalid credentials. Raised when a provider is constructed, never retried.
 */
public class ConfigurationException extends BillingException {

    public ConfigurationException(String message, String code, ProviderType provider) {
        super(message, code, provider, 500);
    }

    public ConfigurationException(String message, String code, ProviderType provider, Throwable cause) {
        super(message, code, provider, 500, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
