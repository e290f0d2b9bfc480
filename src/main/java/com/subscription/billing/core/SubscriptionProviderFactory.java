package com.subscription.billing.core;

import com.subscription.billing.domain.ProviderType;

/**
 * Builds one provider instance. Implementations validate credentials in {@link #create()}
 * and throw {@link com.subscription.billing.core.exception.ConfigurationException} when they are missing.
 */
public interface SubscriptionProviderFactory {

    ProviderType getProviderType();

    /** Whether the provider is switched on in configuration. */
    boolean isEnabled();

    SubscriptionProvider create();
}
