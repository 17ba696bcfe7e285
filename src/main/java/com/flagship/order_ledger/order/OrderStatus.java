package com.flagship.order_ledger.order;

/**
 * Order lifecycle states.
 *
 * CREATED → CONFIRMED
 * CREATED → CANCELLED
 *
 * CONFIRMED and CANCELLED are terminal.
 */
public enum OrderStatus {
    CREATED,
    CONFIRMED,
    CANCELLED
}
