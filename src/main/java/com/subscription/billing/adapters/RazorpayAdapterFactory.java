package com.subscription.billing.adapters;

import com.subscription.billing.core.SubscriptionProvider;
import com.subscription.billing.core.SubscriptionProviderFactory;
import com.subscription.billing.domain.ProviderType;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

@Component
public class RazorpayAdapterFactory implements SubscriptionProviderFactory {

    private final RestTemplate restTemplate;
    private final boolean enabled;
    private final String keyId;
    private final String keySecret;
    private final String webhookSecret;
    private final String baseUrl;

    public RazorpayAdapterFactory(RestTemplate providerRestTemplate,
                                  @Value("${billing.razorpay.enabled:true}") boolean enabled,
                                  @Value("${billing.razorpay.key-id:}") String keyId,
                                  @Value("${billing.razorpay.key-secret:}") String keySecret,
                                  @Value("${billing.razorpay.webhook-secret:}") String webhookSecret,
                                  @Value("${billing.razorpay.base-url:https://api.razorpay.com/v1}") String baseUrl) {
        this.restTemplate = providerRestTemplate;
        this.enabled = enabled;
        this.keyId = keyId;
        this.keySecret = keySecret;
        this.webhookSecret = webhookSecret;
        this.baseUrl = baseUrl;
    }

    @Override
    public ProviderType getProviderType() {
        return ProviderType.RAZORPAY;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public SubscriptionProvider create() {
        return new RazorpayAdapter(keyId, keySecret, webhookSecret, baseUrl, restTemplate);
    }
}
