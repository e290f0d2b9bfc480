package com.subscription.billing.core;

import com.subscription.billing.core.exception.ConfigurationException;
import com.subscription.billing.domain.ProviderType;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Resolves a provider type to its single instance for the process.
 * <p>
 * Lifecycle: an instance is built on first use, which is also when credentials are checked,
 * and stays cached until {@link #clearCache()} is called. A failed construction is not cached,
 * so the next call tries again (and fails again until configuration is fixed).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProviderRegistry {

    private final List<SubscriptionProviderFactory> factories;

    @Value("${billing.providers.validate-on-startup:false}")
    private boolean validateOnStartup;

    private final Map<ProviderType, SubscriptionProvider> instances = new ConcurrentHashMap<>();
    private Map<ProviderType, SubscriptionProviderFactory> factoryByType;

    @PostConstruct
    void init() {
        factoryByType = factories.stream()
                .collect(Collectors.toMap(SubscriptionProviderFactory::getProviderType, f -> f, (first, second) -> first));
        log.info("Registered subscription provider factories: {}", factoryByType.keySet());
        if (validateOnStartup) {
            factoryByType.values().stream()
                    .filter(SubscriptionProviderFactory::isEnabled)
                    .forEach(f -> {
                        get(f.getProviderType());
                        log.info("Provider {} credentials validated at startup", f.getProviderType().getToken());
                    });
        }
    }

    /**
     * Returns the cached provider, building it on first use.
     * @throws ConfigurationException when the provider is unknown, disabled or misconfigured
     */
    public SubscriptionProvider get(ProviderType type) {
        SubscriptionProvider cached = instances.get(type);
        if (cached != null) {
            return cached;
        }
        SubscriptionProviderFactory factory = factoryByType.get(type);
        if (factory == null) {
            throw new ConfigurationException("No provider registered for " + type.getToken(), "PROVIDER_NOT_REGISTERED", type);
        }
        if (!factory.isEnabled()) {
            throw new ConfigurationException("Provider " + type.getToken() + " is disabled", "PROVIDER_DISABLED", type);
        }
        return instances.computeIfAbsent(type, t -> {
            log.info("Initializing subscription provider {}", t.getToken());
            return factory.create();
        });
    }

    /**
     * Token form used by the API and database, e.g. "google_play".
     */
    public SubscriptionProvider get(String providerToken) {
        ProviderType type = ProviderType.fromToken(providerToken)
                .orElseThrow(() -> new ConfigurationException("Unknown provider: " + providerToken, "PROVIDER_NOT_REGISTERED", null));
        return get(type);
    }

    public boolean isValidProviderType(String providerToken) {
        return ProviderType.fromToken(providerToken)
                .map(factoryByType::get)
                .map(SubscriptionProviderFactory::isEnabled)
                .orElse(false);
    }

    /** Drops every cached instance. Intended for tests and credential rotation. */
    public void clearCache() {
        log.info("Clearing {} cached subscription provider instance(s)", instances.size());
        instances.clear();
    }
}
