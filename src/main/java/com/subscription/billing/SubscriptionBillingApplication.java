package com.subscription.billing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the subscription billing service. Enables:
 * <ul>
 *   <li>Razorpay, Google Play and App Store subscriptions behind one provider interface</li>
 *   <li>Verified webhooks and store notifications reconciled into an append-only ledger</li>
 *   <li>Idempotency (Redis), circuit breaker and retry (Resilience4j)</li>
 *   <li>Kafka events for every applied transition</li>
 *   <li>REST API and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
public class SubscriptionBillingApplication {

    public static void main(String[] args) {
        SpringApplication.run(SubscriptionBillingApplication.class, args);
    }
}
