package com.subscription.billing.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.subscription.billing.canonical.EventCanonicalizer;
import com.subscription.billing.canonical.PubSubMessage;
import com.subscription.billing.compliance.ComplianceAuditLogger;
import com.subscription.billing.compliance.SensitiveDataMasker;
import com.subscription.billing.core.exception.VerificationException;
import com.subscription.billing.domain.CanonicalEvent;
import com.subscription.billing.domain.CanonicalEventType;
import com.subscription.billing.domain.ProviderType;
import com.subscription.billing.domain.TransitionOutcome;
import com.subscription.billing.persistence.entity.SubscriptionEntity;
import com.subscription.billing.persistence.entity.WebhookEventEntity;
import com.subscription.billing.persistence.repository.SubscriptionRepository;
import com.subscription.billing.persistence.service.LedgerResult;
import com.subscription.billing.persistence.service.WebhookEventStore;
import com.subscription.billing.verification.AppleNotification;
import com.subscription.billing.verification.AppleSignedPayloadVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Inbound notification pipeline shared by all providers:
 * authenticate, canonicalize, dedupe in the inbox, record on the ledger, settle the inbox row.
 * Provider fetches are never made on this path; they go to {@link ReconciliationScheduler}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookReconciliationService {

    static final String SUBSCRIPTION_NOT_FOUND = "subscription not found";

    private final ProviderRegistry providerRegistry;
    private final EventCanonicalizer canonicalizer;
    private final AppleSignedPayloadVerifier appleSignedPayloadVerifier;
    private final WebhookEventStore webhookEventStore;
    private final SubscriptionRepository subscriptionRepository;
    private final SubscriptionEventRecorder recorder;
    private final ReconciliationScheduler reconciliationScheduler;
    private final ReceiptService receiptService;
    private final ComplianceAuditLogger auditLogger;

    public WebhookResult handleRazorpay(String rawBody, String signature, String eventIdHeader) {
        SubscriptionProvider provider = providerRegistry.get(ProviderType.RAZORPAY);
        if (!provider.verifyWebhookSignature(rawBody, signature)) {
            throw rejected(ProviderType.RAZORPAY, "signature mismatch", SensitiveDataMasker.maskSignature(signature));
        }
        String notificationId = eventIdHeader != null && !eventIdHeader.isBlank()
                ? eventIdHeader
                : "sha256:" + sha256Hex(rawBody);
        Optional<CanonicalEvent> event = canonicalizer.fromRazorpayWebhook(rawBody, notificationId);
        return process(ProviderType.RAZORPAY, notificationId, rawBody, event);
    }

    public WebhookResult handleGooglePlay(String rawBody, String pushToken) {
        SubscriptionProvider provider = providerRegistry.get(ProviderType.GOOGLE_PLAY);
        if (!provider.verifyWebhookSignature(rawBody, pushToken)) {
            throw rejected(ProviderType.GOOGLE_PLAY, "push token mismatch", SensitiveDataMasker.maskToken(pushToken));
        }
        PubSubMessage message = canonicalizer.decodePubSubPush(rawBody);
        JsonNode notification = message.getData();
        Optional<CanonicalEvent> event = canonicalizer.fromGooglePlayNotification(notification, message.getMessageId());
        return process(ProviderType.GOOGLE_PLAY, message.getMessageId(), notification.toString(), event);
    }

    public WebhookResult handleApple(String rawBody) {
        // Resolving the provider enforces the enabled flag and configuration.
        providerRegistry.get(ProviderType.APPLE_APPSTORE);
        AppleNotification verified;
        try {
            verified = appleSignedPayloadVerifier.verifyNotification(rawBody);
        } catch (VerificationException e) {
            auditLogger.logVerificationRejected(ProviderType.APPLE_APPSTORE, e.getMessage(), "signedPayload");
            throw e;
        }
        Object uuid = verified.getNotification().get("notificationUUID");
        String notificationId = uuid != null ? uuid.toString() : "sha256:" + sha256Hex(rawBody);
        Optional<CanonicalEvent> event = canonicalizer.fromAppleNotification(verified.getNotification(),
                verified.getTransaction());
        return process(ProviderType.APPLE_APPSTORE, notificationId, rawBody, event);
    }

    private WebhookResult process(ProviderType providerType, String notificationId, String payload,
                                  Optional<CanonicalEvent> maybeEvent) {
        String eventType = maybeEvent.map(CanonicalEvent::getNativeEventType).orElse("unmapped");
        Optional<WebhookEventEntity> registered = webhookEventStore.register(providerType, notificationId, eventType, payload);
        if (registered.isEmpty()) {
            log.info("Duplicate {} notification {}, acknowledging", providerType.getToken(), notificationId);
            return WebhookResult.of(WebhookResult.Status.DUPLICATE);
        }
        WebhookEventEntity inbox = registered.get();

        if (maybeEvent.isEmpty()) {
            webhookEventStore.markIgnored(inbox.getId(), "no canonical mapping for " + eventType);
            return WebhookResult.of(WebhookResult.Status.IGNORED);
        }
        CanonicalEvent event = maybeEvent.get();

        Optional<SubscriptionEntity> subscription = subscriptionRepository
                .findByProviderAndProviderSubscriptionId(providerType, event.getProviderSubscriptionId());
        if (subscription.isEmpty()) {
            log.warn("{} notification {} ({}) for unknown subscription {}", providerType.getToken(), notificationId,
                    eventType, SensitiveDataMasker.maskToken(event.getProviderSubscriptionId()));
            webhookEventStore.markFailed(inbox.getId(), null, SUBSCRIPTION_NOT_FOUND);
            return WebhookResult.of(WebhookResult.Status.UNKNOWN_SUBSCRIPTION);
        }
        SubscriptionEntity sub = subscription.get();

        if (event.isRequiresProviderFetch()) {
            reconciliationScheduler.schedule(ReconciliationTask.builder()
                    .provider(providerType)
                    .subscriptionId(sub.getId())
                    .providerSubscriptionId(sub.getProviderSubscriptionId())
                    .webhookEventId(inbox.getId())
                    .pendingEvent(event)
                    .reason(eventType)
                    .build());
            return WebhookResult.builder()
                    .status(WebhookResult.Status.DEFERRED)
                    .subscriptionId(sub.getId())
                    .subscriptionStatus(sub.getStatus())
                    .build();
        }

        LedgerResult result;
        try {
            result = recorder.record(sub.getId(), event, "webhook:" + providerType.getToken());
        } catch (RuntimeException e) {
            webhookEventStore.markFailed(inbox.getId(), sub.getId(), e.getMessage());
            throw e;
        }
        webhookEventStore.markProcessed(inbox.getId(), sub.getId());

        if (result.getOutcome() == TransitionOutcome.CONFLICT) {
            reconciliationScheduler.schedule(ReconciliationTask.builder()
                    .provider(providerType)
                    .subscriptionId(sub.getId())
                    .providerSubscriptionId(sub.getProviderSubscriptionId())
                    .reason("conflict:" + event.getType().getToken())
                    .build());
        }
        if (result.isApplied() && isRefund(event) && providerType.isStore()) {
            receiptService.markRefunded(providerType, event.getProviderSubscriptionId());
        }

        return WebhookResult.builder()
                .status(result.isDuplicate() ? WebhookResult.Status.DUPLICATE : WebhookResult.Status.PROCESSED)
                .subscriptionId(sub.getId())
                .outcome(result.getOutcome())
                .subscriptionStatus(result.getNewStatus())
                .build();
    }

    private static boolean isRefund(CanonicalEvent event) {
        if (event.getType() != CanonicalEventType.CANCELLED) {
            return false;
        }
        String reason = event.getCancellationReason();
        return "refunded".equals(reason) || "revoked".equals(reason);
    }

    private VerificationException rejected(ProviderType provider, String reason, String maskedReference) {
        auditLogger.logVerificationRejected(provider, reason, maskedReference);
        return new VerificationException("Webhook authentication failed", "INVALID_SIGNATURE", provider, 401);
    }

    private static String sha256Hex(String raw) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(raw.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
