package com.subscription.billing.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Payment attached to a provider event (Razorpay payment entity, store order / transaction).
 * Amount is in minor units; it is null when the provider does not report it.
 */
@Value
@Builder
@Jacksonized
public class PaymentSnapshot {

    String paymentId;
    Long amount;
    String currency;
    InvoiceStatus status;
    String method;
    Instant paidAt;
}
