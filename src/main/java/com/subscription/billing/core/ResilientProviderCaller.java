package com.subscription.billing.core;

import com.subscription.billing.core.exception.BillingException;
import com.subscription.billing.core.exception.ProviderFetchException;
import com.subscription.billing.domain.ProviderType;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Calls a provider with bounded retries and a per-provider circuit breaker.
 * Only transient failures are retried or counted against the breaker; "not supported",
 * verification and configuration failures return immediately.
 */
@Slf4j
@Service
public class ResilientProviderCaller {

    private static final String RETRY_INSTANCE = "provider";

    private final ProviderRegistry providerRegistry;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final Retry retry;
    private final CircuitBreakerConfig circuitBreakerConfig;

    public ResilientProviderCaller(ProviderRegistry providerRegistry,
                                   CircuitBreakerRegistry circuitBreakerRegistry,
                                   RetryRegistry retryRegistry,
                                   @Value("${billing.providers.retry.max-attempts:3}") int maxAttempts,
                                   @Value("${billing.providers.retry.initial-backoff-ms:200}") long initialBackoffMs) {
        this.providerRegistry = providerRegistry;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(Math.max(1, maxAttempts))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(initialBackoffMs), 2.0))
                .retryOnException(ResilientProviderCaller::isTransient)
                .build();
        this.retry = retryRegistry.retry(RETRY_INSTANCE, retryConfig);
        this.circuitBreakerConfig = CircuitBreakerConfig.from(circuitBreakerRegistry.getDefaultConfig())
                .recordException(ResilientProviderCaller::isTransient)
                .build();
    }

    /**
     * Resolve the provider and run {@code operation} against it.
     */
    public <T> ProviderCallResult<T> call(ProviderType type, String operationName, Function<SubscriptionProvider, T> operation) {
        SubscriptionProvider provider;
        try {
            provider = providerRegistry.get(type);
        } catch (BillingException e) {
            log.error("Provider {} unavailable for {}: {}", type.getToken(), operationName, e.getMessage());
            return ProviderCallResult.failure(e);
        }

        CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(provider.getProviderName(), circuitBreakerConfig);
        Supplier<T> supplier = () -> operation.apply(provider);
        Supplier<T> withRetry = Retry.decorateSupplier(retry, supplier);
        Supplier<T> withCb = CircuitBreaker.decorateSupplier(cb, withRetry);

        long startTime = System.currentTimeMillis();
        try {
            T value = withCb.get();
            log.debug("Provider call {}.{} succeeded in {}ms", type.getToken(), operationName,
                    System.currentTimeMillis() - startTime);
            return ProviderCallResult.success(value);
        } catch (CallNotPermittedException e) {
            log.warn("Circuit open for provider={} operation={}", type.getToken(), operationName);
            return ProviderCallResult.failure(new ProviderFetchException(
                    "Provider temporarily unavailable", "PROVIDER_CIRCUIT_OPEN", type, 503, e));
        } catch (BillingException e) {
            if (e.isRetryable()) {
                log.error("Provider call {}.{} failed after retries: code={} status={}",
                        type.getToken(), operationName, e.getCode(), e.getHttpStatus());
            } else {
                log.warn("Provider call {}.{} failed permanently: code={} message={}",
                        type.getToken(), operationName, e.getCode(), e.getMessage());
            }
            return ProviderCallResult.failure(e);
        } catch (RuntimeException e) {
            log.error("Unexpected error calling provider {}.{}", type.getToken(), operationName, e);
            return ProviderCallResult.failure(new ProviderFetchException(
                    "Provider call failed", "PROVIDER_CALL_FAILED", type, 500, e));
        }
    }

    private static boolean isTransient(Throwable t) {
        return t instanceof BillingException && ((BillingException) t).isRetryable();
    }
}
