package com.subscription.billing.compliance;

import com.subscription.billing.domain.ProviderType;
import com.subscription.billing.persistence.service.LedgerResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Audit lines for subscription transitions, rejected notifications and abandoned reconciliations.
 * Values that could identify a purchase are masked before they get here.
 */
@Slf4j
@Component
public class ComplianceAuditLogger {

    public void logTransition(LedgerResult result, String source) {
        log.info("[AUDIT] SUBSCRIPTION_TRANSITION subscriptionId={} provider={} event={} outcome={} previousStatus={} newStatus={} source={}",
                result.getSubscriptionId(),
                result.getProvider() != null ? result.getProvider().getToken() : null,
                result.getEventType() != null ? result.getEventType().getToken() : null,
                result.getOutcome(),
                result.getPreviousStatus() != null ? result.getPreviousStatus().getToken() : null,
                result.getNewStatus() != null ? result.getNewStatus().getToken() : null,
                source);
    }

    public void logVerificationRejected(ProviderType provider, String reason, String maskedReference) {
        log.warn("[AUDIT] VERIFICATION_REJECTED provider={} reason={} reference={}",
                provider.getToken(), reason, maskedReference);
    }

    public void logDeadLetter(ProviderType provider, UUID subscriptionId, String reason, int attempts) {
        log.error("[AUDIT] RECONCILIATION_DEAD_LETTER provider={} subscriptionId={} attempts={} reason={}",
                provider.getToken(), subscriptionId, attempts, reason);
    }

    public void logUserOperation(String operation, String userId, UUID subscriptionId, String detail) {
        log.info("[AUDIT] SUBSCRIPTION_{} userId={} subscriptionId={} detail={}",
                operation, userId, subscriptionId, detail);
    }
}
