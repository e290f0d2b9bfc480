package com.subscription.billing.compliance;

/**
 * Redacts purchase tokens, receipts and signatures so they are safe to include in logs.
 */
public final class SensitiveDataMasker {

    private static final String MASK = "***";
    private static final int VISIBLE_SUFFIX = 4;

    private SensitiveDataMasker() {}

    /** Keeps the last four characters of long tokens (e.g. "abcdefghij1234" -> "***1234"). */
    public static String maskToken(String token) {
        if (token == null || token.isBlank()) return null;
        if (token.length() <= 2 * VISIBLE_SUFFIX) return MASK;
        return MASK + token.substring(token.length() - VISIBLE_SUFFIX);
    }

    /** Keeps the product id of a {@code productId:token} receipt and masks the token part. */
    public static String maskReceipt(String receipt) {
        if (receipt == null || receipt.isBlank()) return null;
        int idx = receipt.indexOf(':');
        if (idx < 0) return maskToken(receipt);
        return receipt.substring(0, idx) + ":" + maskToken(receipt.substring(idx + 1));
    }

    /** Signatures are never logged, only whether one was present. */
    public static String maskSignature(String signature) {
        if (signature == null || signature.isBlank()) return "<absent>";
        return MASK;
    }
}
