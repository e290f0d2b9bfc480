package com.subscription.billing.domain;

public enum WebhookProcessingStatus {
    PENDING,
    PROCESSED,
    FAILED,
    IGNORED
}
