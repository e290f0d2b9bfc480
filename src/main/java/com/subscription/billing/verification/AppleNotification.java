package com.subscription.billing.verification;

import lombok.Value;

import java.util.Map;

/**
 * Verified claims of an App Store Server Notification and its transaction.
 */
@Value
public class AppleNotification {

    Map<String, Object> notification;
    /** Empty for notifications that carry no transaction (e.g. TEST). */
    Map<String, Object> transaction;
}
