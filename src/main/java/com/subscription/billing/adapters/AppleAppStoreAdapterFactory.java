package com.subscription.billing.adapters;

import com.subscription.billing.core.SubscriptionProvider;
import com.subscription.billing.core.SubscriptionProviderFactory;
import com.subscription.billing.domain.ProviderType;
import com.subscription.billing.verification.AppleSignedPayloadVerifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Component
public class AppleAppStoreAdapterFactory implements SubscriptionProviderFactory {

    private final RestTemplate restTemplate;
    private final AppleSignedPayloadVerifier payloadVerifier;
    private final Clock clock;

    @Value("${billing.apple.enabled:true}")
    private boolean enabled;

    @Value("${billing.apple.shared-secret:}")
    private String sharedSecret;

    @Value("${billing.apple.bundle-id:}")
    private String bundleId;

    @Value("${billing.apple.verify-receipt-url:https://buy.itunes.apple.com/verifyReceipt}")
    private String productionUrl;

    @Value("${billing.apple.sandbox-verify-receipt-url:https://sandbox.itunes.apple.com/verifyReceipt}")
    private String sandboxUrl;

    @Value("${billing.apple.exclude-old-transactions:true}")
    private boolean excludeOldTransactions;

    public AppleAppStoreAdapterFactory(RestTemplate providerRestTemplate, AppleSignedPayloadVerifier payloadVerifier, Clock clock) {
        this.restTemplate = providerRestTemplate;
        this.payloadVerifier = payloadVerifier;
        this.clock = clock;
    }

    @Override
    public ProviderType getProviderType() {
        return ProviderType.APPLE_APPSTORE;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public SubscriptionProvider create() {
        return new AppleAppStoreAdapter(sharedSecret, bundleId, productionUrl, sandboxUrl, excludeOldTransactions,
                payloadVerifier, restTemplate, clock);
    }
}
