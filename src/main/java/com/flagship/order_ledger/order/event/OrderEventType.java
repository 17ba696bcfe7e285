package com.flagship.order_ledger.order.event;

import java.util.Arrays;

/**
 * Type tags for order events, with the name each one is stored under.
 *
 * UNRECOGNIZED stands for a stored name this build does not know.
 * The projection skips such events; the write side treats them as corruption.
 */
public enum OrderEventType {
    ORDER_CREATED(OrderCreated.EVENT_TYPE, OrderCreated.class),
    ITEM_ADDED(ItemAdded.EVENT_TYPE, ItemAdded.class),
    ORDER_CONFIRMED(OrderConfirmed.EVENT_TYPE, OrderConfirmed.class),
    ORDER_CANCELLED(OrderCancelled.EVENT_TYPE, OrderCancelled.class),
    UNRECOGNIZED(UnrecognizedEvent.EVENT_TYPE, UnrecognizedEvent.class);

    private final String wireName;
    private final Class<? extends OrderEventPayload> payloadClass;

    OrderEventType(String wireName, Class<? extends OrderEventPayload> payloadClass) {
        this.wireName = wireName;
        this.payloadClass = payloadClass;
    }

    public String getWireName() {
        return wireName;
    }

    public Class<? extends OrderEventPayload> getPayloadClass() {
        return payloadClass;
    }

    /**
     * Resolves a stored type name. Unknown names map to UNRECOGNIZED, never to an exception.
     */
    public static OrderEventType fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(type -> type != UNRECOGNIZED && type.wireName.equals(wireName))
                .findFirst()
                .orElse(UNRECOGNIZED);
    }
}
