package com.subscription.billing.core;

import com.subscription.billing.domain.ReceiptValidationResult;
import com.subscription.billing.persistence.entity.SubscriptionEntity;
import com.subscription.billing.persistence.service.LedgerResult;
import lombok.Builder;
import lombok.Value;

/**
 * Receipt validation plus what it did to the user's subscription. subscription is null when an
 * invalid receipt matched nothing; ledgerResult is null when the ledger was not touched.
 */
@Value
@Builder
public class ReceiptValidationOutcome {

    ReceiptValidationResult validation;
    SubscriptionEntity subscription;
    LedgerResult ledgerResult;
    boolean created;
}
