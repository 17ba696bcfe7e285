package com.flagship.order_ledger.order.exception;

import java.util.UUID;

/**
 * A command targeted an order whose stream is empty.
 *
 * Queries never throw this; they return an empty Optional.
 */
public class OrderNotFoundException extends InvariantViolationException {

    public OrderNotFoundException(UUID orderId) {
        super(orderId, "Order not found: " + orderId);
    }
}
