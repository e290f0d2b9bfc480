package com.subscription.billing.domain;

public enum InvoiceStatus {
    PAID,
    FAILED,
    PENDING,
    REFUNDED
}
