package com.subscription.billing.verification;

import com.subscription.billing.core.exception.VerificationException;
import com.subscription.billing.domain.ProviderType;
import lombok.Value;

/**
 * A client-submitted receipt in {@code productId:token} form. Only the first ':' separates the
 * parts; the token may contain more.
 */
@Value
public class ReceiptToken {

    public static final String INVALID_FORMAT = "INVALID_RECEIPT_FORMAT";

    String productId;
    String token;

    public static ReceiptToken parse(String receipt, ProviderType provider) {
        if (receipt == null || receipt.isBlank()) {
            throw new VerificationException("Receipt is empty", INVALID_FORMAT, provider);
        }
        int idx = receipt.indexOf(':');
        if (idx < 0) {
            throw new VerificationException("Receipt must be formatted as productId:token", INVALID_FORMAT, provider);
        }
        String productId = receipt.substring(0, idx).trim();
        String token = receipt.substring(idx + 1).trim();
        if (productId.isEmpty() || token.isEmpty()) {
            throw new VerificationException("Receipt product id and token must not be blank", INVALID_FORMAT, provider);
        }
        return new ReceiptToken(productId, token);
    }
}
