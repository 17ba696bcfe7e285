package com.flagship.order_ledger.order.exception;

import java.util.UUID;

/**
 * The payment gateway refused to authorize the order total, so the order stays CREATED.
 */
public class PaymentDeclinedException extends InvariantViolationException {

    private final String declineReason;

    public PaymentDeclinedException(UUID orderId, String declineReason) {
        super(orderId, String.format("Payment declined for order %s: %s", orderId, declineReason));
        this.declineReason = declineReason;
    }

    public String getDeclineReason() {
        return declineReason;
    }
}
