package com.subscription.billing.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

/**
 * Outbound HTTP for provider APIs, with bounded connect and read timeouts.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate providerRestTemplate(@Value("${billing.http.connect-timeout-ms:5000}") int connectTimeoutMs,
                                             @Value("${billing.http.read-timeout-ms:10000}") int readTimeoutMs) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(Duration.ofMillis(readTimeoutMs));
        RestTemplate restTemplate = new RestTemplate();
        restTemplate.setRequestFactory(factory);
        return restTemplate;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
