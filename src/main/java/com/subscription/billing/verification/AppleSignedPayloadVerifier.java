package com.subscription.billing.verification;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSObject;
import com.nimbusds.jose.crypto.ECDSAVerifier;
import com.nimbusds.jose.util.Base64;
import com.nimbusds.jose.util.JSONObjectUtils;
import com.nimbusds.jose.util.X509CertChainUtils;
import com.subscription.billing.core.exception.VerificationException;
import com.subscription.billing.domain.ProviderType;
import lombok.extern.slf4j.Slf4j;

import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.cert.X509Certificate;
import java.security.interfaces.ECPublicKey;
import java.text.ParseException;
import java.time.Clock;
import java.util.Date;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Verifies App Store Server Notification JWS values ({@code signedPayload},
 * {@code signedTransactionInfo}, {@code signedRenewalInfo}).
 * <p>
 * The x5c chain must link leaf to intermediate to a root whose SHA-256 fingerprint matches the
 * configured Apple root, every certificate must be valid now, and the payload must verify with
 * the leaf key using ES256. Without a configured fingerprint every payload is rejected.
 */
@Slf4j
public class AppleSignedPayloadVerifier {

    static final String LEAF_MARKER_OID = "1.2.840.113635.100.6.11.1";
    static final String INTERMEDIATE_MARKER_OID = "1.2.840.113635.100.6.2.1";
    private static final String CODE = "APPLE_JWS_INVALID";

    private final String rootFingerprint;
    private final boolean requireAppleExtensions;
    private final Clock clock;

    public AppleSignedPayloadVerifier(String rootCaSha256, boolean requireAppleExtensions, Clock clock) {
        this.rootFingerprint = normalizeFingerprint(rootCaSha256);
        this.requireAppleExtensions = requireAppleExtensions;
        this.clock = clock;
    }

    public boolean isConfigured() {
        return rootFingerprint != null;
    }

    /**
     * @return the verified JSON payload
     * @throws VerificationException on any failure
     */
    public Map<String, Object> verify(String jws) {
        if (!isConfigured()) {
            throw new VerificationException("Apple root certificate fingerprint is not configured",
                    "APPLE_ROOT_NOT_CONFIGURED", ProviderType.APPLE_APPSTORE, 401);
        }
        if (jws == null || jws.isBlank()) {
            throw reject("signed payload is empty");
        }

        JWSObject object;
        try {
            object = JWSObject.parse(jws);
        } catch (ParseException e) {
            throw reject("signed payload is not a JWS: " + e.getMessage());
        }
        if (!JWSAlgorithm.ES256.equals(object.getHeader().getAlgorithm())) {
            throw reject("unexpected algorithm " + object.getHeader().getAlgorithm());
        }

        List<X509Certificate> chain = parseChain(object.getHeader().getX509CertChain());
        verifyChain(chain);

        X509Certificate leaf = chain.get(0);
        if (!(leaf.getPublicKey() instanceof ECPublicKey)) {
            throw reject("leaf certificate key is not an EC key");
        }
        try {
            if (!object.verify(new ECDSAVerifier((ECPublicKey) leaf.getPublicKey()))) {
                throw reject("payload signature does not match leaf certificate");
            }
        } catch (JOSEException e) {
            throw reject("payload signature could not be checked: " + e.getMessage());
        }
        return object.getPayload().toJSONObject();
    }

    /**
     * Verifies a raw notification body {@code {"signedPayload": "..."}} and the
     * {@code data.signedTransactionInfo} it carries.
     */
    public AppleNotification verifyNotification(String rawBody) {
        String signedPayload;
        try {
            signedPayload = JSONObjectUtils.getString(JSONObjectUtils.parse(rawBody), "signedPayload");
        } catch (ParseException | RuntimeException e) {
            throw reject("notification body is not a JSON object with a signedPayload string");
        }
        if (signedPayload == null) {
            throw reject("signedPayload missing");
        }
        Map<String, Object> notification = verify(signedPayload);

        String signedTransaction;
        try {
            Map<String, Object> data = JSONObjectUtils.getJSONObject(notification, "data");
            signedTransaction = data != null ? JSONObjectUtils.getString(data, "signedTransactionInfo") : null;
        } catch (ParseException e) {
            throw reject("notification data is malformed: " + e.getMessage());
        }
        Map<String, Object> transaction = signedTransaction != null ? verify(signedTransaction) : Map.of();
        return new AppleNotification(notification, transaction);
    }

    private List<X509Certificate> parseChain(List<Base64> x5c) {
        if (x5c == null || x5c.size() < 2) {
            throw reject("x5c chain is missing or too short");
        }
        try {
            return X509CertChainUtils.parse(x5c);
        } catch (ParseException e) {
            throw reject("x5c chain is malformed: " + e.getMessage());
        }
    }

    private void verifyChain(List<X509Certificate> chain) {
        Date now = Date.from(clock.instant());
        try {
            for (int i = 0; i < chain.size(); i++) {
                X509Certificate cert = chain.get(i);
                cert.checkValidity(now);
                X509Certificate issuer = i + 1 < chain.size() ? chain.get(i + 1) : cert;
                cert.verify(issuer.getPublicKey());
            }
        } catch (GeneralSecurityException e) {
            throw reject("certificate chain does not verify: " + e.getMessage());
        }

        X509Certificate root = chain.get(chain.size() - 1);
        if (!fingerprintMatches(root)) {
            throw reject("root certificate is not the configured Apple root");
        }
        if (requireAppleExtensions) {
            if (chain.get(0).getExtensionValue(LEAF_MARKER_OID) == null) {
                throw reject("leaf certificate lacks the App Store receipt signing extension");
            }
            if (chain.size() > 2 && chain.get(1).getExtensionValue(INTERMEDIATE_MARKER_OID) == null) {
                throw reject("intermediate certificate lacks the Apple WWDR extension");
            }
        }
    }

    private boolean fingerprintMatches(X509Certificate root) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(root.getEncoded());
            return WebhookSignatureVerifier.constantTimeEquals(rootFingerprint, HexFormat.of().formatHex(digest));
        } catch (GeneralSecurityException e) {
            log.error("Could not fingerprint root certificate", e);
            return false;
        }
    }

    static String normalizeFingerprint(String fingerprint) {
        if (fingerprint == null || fingerprint.isBlank()) {
            return null;
        }
        return fingerprint.replace(":", "").replaceAll("\\s", "").toLowerCase(Locale.ROOT);
    }

    private static VerificationException reject(String reason) {
        log.warn("App Store signed payload rejected: {}", reason);
        return new VerificationException("App Store notification could not be verified", CODE,
                ProviderType.APPLE_APPSTORE, 401);
    }
}
