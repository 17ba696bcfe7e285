package com.flagship.order_ledger.order.exception;

import java.util.UUID;

/**
 * Aggregate behavior invoked in a state that forbids it,
 * e.g. adding items to a confirmed order.
 *
 * A business outcome returned to the caller as a rejection. Never retried.
 */
public class InvariantViolationException extends RuntimeException {

    private final UUID orderId;

    public InvariantViolationException(UUID orderId, String message) {
        super(message);
        this.orderId = orderId;
    }

    public UUID getOrderId() {
        return orderId;
    }
}
