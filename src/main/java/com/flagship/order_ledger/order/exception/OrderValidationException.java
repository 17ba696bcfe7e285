package com.flagship.order_ledger.order.exception;

/**
 * Command input violates a domain rule at creation time.
 *
 * A business outcome returned to the caller as a rejection. Never retried.
 */
public class OrderValidationException extends RuntimeException {

    public OrderValidationException(String message) {
        super(message);
    }
}
