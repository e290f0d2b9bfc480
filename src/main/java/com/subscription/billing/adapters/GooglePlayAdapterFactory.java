package com.subscription.billing.adapters;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.subscription.billing.core.SubscriptionProvider;
import com.subscription.billing.core.SubscriptionProviderFactory;
import com.subscription.billing.domain.ProviderType;
import com.subscription.billing.verification.GooglePlayAccessTokenProvider;
import com.subscription.billing.verification.ServiceAccountKey;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Component
public class GooglePlayAdapterFactory implements SubscriptionProviderFactory {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Value("${billing.google-play.enabled:true}")
    private boolean enabled;

    @Value("${billing.google-play.package-name:}")
    private String packageName;

    @Value("${billing.google-play.service-account-key:}")
    private String serviceAccountKey;

    @Value("${billing.google-play.rtdn-token:}")
    private String rtdnToken;

    @Value("${billing.google-play.use-legacy-api:false}")
    private boolean useLegacyApi;

    @Value("${billing.google-play.base-url:https://androidpublisher.googleapis.com/androidpublisher/v3}")
    private String baseUrl;

    @Value("${billing.google-play.token-refresh-buffer-seconds:300}")
    private long tokenRefreshBufferSeconds;

    public GooglePlayAdapterFactory(RestTemplate providerRestTemplate, ObjectMapper objectMapper, Clock clock) {
        this.restTemplate = providerRestTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public ProviderType getProviderType() {
        return ProviderType.GOOGLE_PLAY;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public SubscriptionProvider create() {
        ServiceAccountKey key = ServiceAccountKey.fromJson(serviceAccountKey, objectMapper);
        GooglePlayAccessTokenProvider tokenProvider = new GooglePlayAccessTokenProvider(key, restTemplate, clock,
                Duration.ofSeconds(tokenRefreshBufferSeconds));
        return new GooglePlayAdapter(packageName, tokenProvider, rtdnToken, useLegacyApi, baseUrl, restTemplate, clock);
    }
}
