package com.flagship.order_ledger.integration;

import lombok.Value;

/**
 * Outcome of a payment authorization.
 */
@Value
public class PaymentReceipt {
    boolean approved;
    String transactionId;
    String declineReason;

    public static PaymentReceipt approved(String transactionId) {
        return new PaymentReceipt(true, transactionId, null);
    }

    public static PaymentReceipt declined(String reason) {
        return new PaymentReceipt(false, null, reason);
    }
}
