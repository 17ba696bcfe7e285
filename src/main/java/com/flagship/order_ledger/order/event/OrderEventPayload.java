package com.flagship.order_ledger.order.event;

/**
 * The closed set of facts that can happen to an order.
 *
 * Adding a variant means adding an {@link OrderEventType} constant, which in
 * turn breaks every exhaustive switch over the type until it is handled.
 */
public sealed interface OrderEventPayload
        permits OrderCreated, ItemAdded, OrderConfirmed, OrderCancelled, UnrecognizedEvent {

    /**
     * The type tag this payload is stored and routed under.
     */
    OrderEventType type();
}
