package com.subscription.billing.verification;

import com.fasterxml.jackson.databind.JsonNode;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import com.subscription.billing.core.exception.BillingException;
import com.subscription.billing.core.exception.ConfigurationException;
import com.subscription.billing.core.exception.ProviderFetchException;
import com.subscription.billing.domain.ProviderType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * OAuth2 access token for the Google Play Developer API, obtained with a service-account signed JWT.
 * <p>
 * Lifecycle: fetched on first use, cached until {@code expires_in} minus the refresh buffer, dropped
 * by {@link #invalidate()}. Concurrent callers that find the cache stale share a single refresh.
 */
@Slf4j
public class GooglePlayAccessTokenProvider {

    public static final String SCOPE = "https://www.googleapis.com/auth/androidpublisher";
    static final String GRANT_TYPE = "urn:ietf:params:oauth:grant-type:jwt-bearer";
    private static final Duration ASSERTION_LIFETIME = Duration.ofHours(1);

    private final ServiceAccountKey key;
    private final RestTemplate restTemplate;
    private final Clock clock;
    private final Duration refreshBuffer;

    private final Object lock = new Object();
    private volatile CachedToken cached;
    private CompletableFuture<CachedToken> inFlight;

    public GooglePlayAccessTokenProvider(ServiceAccountKey key, RestTemplate restTemplate, Clock clock, Duration refreshBuffer) {
        this.key = key;
        this.restTemplate = restTemplate;
        this.clock = clock;
        this.refreshBuffer = refreshBuffer;
    }

    public String getAccessToken() {
        CachedToken current = cached;
        if (current != null && current.isUsableAt(clock.instant(), refreshBuffer)) {
            return current.token;
        }

        CompletableFuture<CachedToken> future;
        boolean owner = false;
        synchronized (lock) {
            current = cached;
            if (current != null && current.isUsableAt(clock.instant(), refreshBuffer)) {
                return current.token;
            }
            if (inFlight == null) {
                inFlight = new CompletableFuture<>();
                owner = true;
            }
            future = inFlight;
        }

        if (owner) {
            try {
                CachedToken fresh = exchange();
                cached = fresh;
                future.complete(fresh);
                return fresh.token;
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
                throw e;
            } finally {
                synchronized (lock) {
                    inFlight = null;
                }
            }
        }

        try {
            return future.join().token;
        } catch (CompletionException e) {
            if (e.getCause() instanceof BillingException) {
                throw (BillingException) e.getCause();
            }
            throw new ProviderFetchException("Google OAuth token refresh failed", "GOOGLE_AUTH_FAILED",
                    ProviderType.GOOGLE_PLAY, 0, e.getCause());
        }
    }

    /** Forces the next call to fetch a new token, e.g. after the API answered 401. */
    public void invalidate() {
        cached = null;
    }

    String buildAssertion(Instant issuedAt) {
        JWTClaimsSet claims = new JWTClaimsSet.Builder()
                .issuer(key.getClientEmail())
                .claim("scope", SCOPE)
                .audience(key.getTokenUri())
                .issueTime(Date.from(issuedAt))
                .expirationTime(Date.from(issuedAt.plus(ASSERTION_LIFETIME)))
                .build();
        JWSHeader.Builder header = new JWSHeader.Builder(JWSAlgorithm.RS256);
        if (key.getPrivateKeyId() != null) {
            header.keyID(key.getPrivateKeyId());
        }
        SignedJWT jwt = new SignedJWT(header.build(), claims);
        try {
            jwt.sign(new RSASSASigner(key.getPrivateKey()));
        } catch (JOSEException e) {
            throw new ConfigurationException("Could not sign service account assertion", "GOOGLE_PLAY_SERVICE_ACCOUNT_INVALID",
                    ProviderType.GOOGLE_PLAY, e);
        }
        return jwt.serialize();
    }

    private CachedToken exchange() {
        Instant now = clock.instant();
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", GRANT_TYPE);
        form.add("assertion", buildAssertion(now));
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        ResponseEntity<JsonNode> response;
        try {
            response = restTemplate.postForEntity(key.getTokenUri(), new HttpEntity<>(form, headers), JsonNode.class);
        } catch (HttpStatusCodeException e) {
            log.error("Google OAuth token exchange rejected: status={}", e.getStatusCode().value());
            throw new ProviderFetchException("Google OAuth token exchange failed", "GOOGLE_AUTH_FAILED",
                    ProviderType.GOOGLE_PLAY, e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            log.warn("Google OAuth token endpoint unreachable: {}", e.getMessage());
            throw new ProviderFetchException("Google OAuth token endpoint unreachable", "GOOGLE_AUTH_FAILED",
                    ProviderType.GOOGLE_PLAY, 0, e);
        }

        JsonNode body = response.getBody();
        String accessToken = body != null ? body.path("access_token").asText(null) : null;
        if (accessToken == null || accessToken.isBlank()) {
            throw new ProviderFetchException("Google OAuth response has no access_token", "GOOGLE_AUTH_FAILED",
                    ProviderType.GOOGLE_PLAY, 502);
        }
        long expiresIn = body.path("expires_in").asLong(3600);
        log.info("Obtained Google Play access token for {}, expires in {}s", key.getClientEmail(), expiresIn);
        return new CachedToken(accessToken, now.plusSeconds(expiresIn));
    }

    private static final class CachedToken {
        private final String token;
        private final Instant expiresAt;

        private CachedToken(String token, Instant expiresAt) {
            this.token = token;
            this.expiresAt = expiresAt;
        }

        private boolean isUsableAt(Instant now, Duration buffer) {
            return now.isBefore(expiresAt.minus(buffer));
        }
    }
}
