package com.subscription.billing.core;

import com.subscription.billing.core.exception.BillingException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of a provider call, tagged so callers can branch on retryability without
 * inspecting error codes.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ProviderCallResult<T> {

    public enum Kind {
        SUCCESS,
        /** Not supported, verification failed, bad request: retrying will not help. */
        PERMANENT_FAILURE,
        /** Timeout, 5xx, circuit open: retry later. */
        TRANSIENT_FAILURE
    }

    Kind kind;
    T value;
    BillingException error;

    public static <T> ProviderCallResult<T> success(T value) {
        return new ProviderCallResult<>(Kind.SUCCESS, value, null);
    }

    public static <T> ProviderCallResult<T> failure(BillingException error) {
        return new ProviderCallResult<>(error.isRetryable() ? Kind.TRANSIENT_FAILURE : Kind.PERMANENT_FAILURE, null, error);
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    public boolean isRetryable() {
        return kind == Kind.TRANSIENT_FAILURE;
    }

    /** The value, or the failure rethrown. */
    public T getOrThrow() {
        if (error != null) {
            throw error;
        }
        return value;
    }
}
