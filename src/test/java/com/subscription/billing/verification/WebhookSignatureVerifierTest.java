package com.subscription.billing.verification;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WebhookSignatureVerifierTest {

    private static final String SECRET = "whsec_test";
    private static final String BODY = "{\"event\":\"subscription.charged\"}";

    @Test
    void acceptsSignatureOverExactBody() {
        String signature = WebhookSignatureVerifier.hmacSha256Hex(BODY, SECRET);

        assertThat(WebhookSignatureVerifier.verifyHmacSha256Hex(BODY, signature, SECRET)).isTrue();
        assertThat(WebhookSignatureVerifier.verifyHmacSha256Hex(BODY, signature.toUpperCase(), SECRET)).isTrue();
    }

    @Test
    void rejectsAnyChangeToBody() {
        String signature = WebhookSignatureVerifier.hmacSha256Hex(BODY, SECRET);

        assertThat(WebhookSignatureVerifier.verifyHmacSha256Hex(BODY + " ", signature, SECRET)).isFalse();
        assertThat(WebhookSignatureVerifier.verifyHmacSha256Hex(BODY, signature, "other_secret")).isFalse();
    }

    @Test
    void rejectsWhenSecretOrSignatureMissing() {
        String signature = WebhookSignatureVerifier.hmacSha256Hex(BODY, SECRET);

        assertThat(WebhookSignatureVerifier.verifyHmacSha256Hex(BODY, signature, "")).isFalse();
        assertThat(WebhookSignatureVerifier.verifyHmacSha256Hex(BODY, signature, null)).isFalse();
        assertThat(WebhookSignatureVerifier.verifyHmacSha256Hex(BODY, null, SECRET)).isFalse();
        assertThat(WebhookSignatureVerifier.verifyHmacSha256Hex(BODY, " ", SECRET)).isFalse();
    }

    @Test
    void constantTimeEqualsTreatsEmptyAsMismatch() {
        assertThat(WebhookSignatureVerifier.constantTimeEquals("abc", "abc")).isTrue();
        assertThat(WebhookSignatureVerifier.constantTimeEquals("abc", "abd")).isFalse();
        assertThat(WebhookSignatureVerifier.constantTimeEquals("", "")).isFalse();
        assertThat(WebhookSignatureVerifier.constantTimeEquals(null, "abc")).isFalse();
    }
}
