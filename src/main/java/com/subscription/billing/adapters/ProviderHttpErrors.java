package com.subscription.billing.adapters;

import com.subscription.billing.core.exception.ProviderFetchException;
import com.subscription.billing.domain.ProviderType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;

/**
 * Translates RestTemplate failures into {@link ProviderFetchException}. The provider response body
 * is logged at debug level only and never put into the exception message.
 */
@Slf4j
final class ProviderHttpErrors {

    private ProviderHttpErrors() {}

    static ProviderFetchException translate(ProviderType provider, String code, String operation, RestClientException e) {
        if (e instanceof HttpStatusCodeException) {
            HttpStatusCodeException statusException = (HttpStatusCodeException) e;
            int status = statusException.getStatusCode().value();
            log.warn("{} {} failed with HTTP {}", provider.getToken(), operation, status);
            log.debug("{} {} error body: {}", provider.getToken(), operation, statusException.getResponseBodyAsString());
            return new ProviderFetchException(provider.getToken() + " " + operation + " failed with HTTP " + status,
                    code, provider, status, e);
        }
        if (e instanceof ResourceAccessException) {
            log.warn("{} {} I/O failure: {}", provider.getToken(), operation, e.getMessage());
            return new ProviderFetchException(provider.getToken() + " " + operation + " timed out or was unreachable",
                    code, provider, 0, e);
        }
        log.error("{} {} failed unexpectedly", provider.getToken(), operation, e);
        return new ProviderFetchException(provider.getToken() + " " + operation + " failed", code, provider, 500, e);
    }
}
