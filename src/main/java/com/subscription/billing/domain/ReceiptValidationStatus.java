package com.subscription.billing.domain;

public enum ReceiptValidationStatus {
    VALID,
    INVALID,
    REFUNDED
}
