package com.flagship.order_ledger.order.event;

import lombok.Value;

/**
 * The order was withdrawn before confirmation.
 */
@Value
public class OrderCancelled implements OrderEventPayload {
    String reason;

    public static final String EVENT_TYPE = "OrderCancelled";

    @Override
    public OrderEventType type() {
        return OrderEventType.ORDER_CANCELLED;
    }
}
