package com.subscription.billing.verification;

import lombok.extern.slf4j.Slf4j;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * HMAC-SHA256 webhook signatures and constant-time secret comparison.
 * Never throws: every failure is a rejection.
 */
@Slf4j
public final class WebhookSignatureVerifier {

    private static final String HMAC_SHA256 = "HmacSHA256";

    private WebhookSignatureVerifier() {}

    /**
     * @param rawPayload exact request body as received
     * @param signatureHex hex digest from the signature header
     * @param secret shared webhook secret; blank rejects everything
     */
    public static boolean verifyHmacSha256Hex(String rawPayload, String signatureHex, String secret) {
        if (secret == null || secret.isBlank()) {
            log.error("Webhook secret is not configured; rejecting notification");
            return false;
        }
        if (rawPayload == null || signatureHex == null || signatureHex.isBlank()) {
            return false;
        }
        String expected = hmacSha256Hex(rawPayload, secret);
        return expected != null && constantTimeEquals(expected, signatureHex.trim().toLowerCase(Locale.ROOT));
    }

    public static String hmacSha256Hex(String payload, String secret) {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
            return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            log.error("HMAC computation failed", e);
            return null;
        }
    }

    /** False when either side is null or blank. */
    public static boolean constantTimeEquals(String expected, String actual) {
        if (expected == null || actual == null || expected.isEmpty() || actual.isEmpty()) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), actual.getBytes(StandardCharsets.UTF_8));
    }
}
