package com.flagship.order_ledger.order.event;

import com.flagship.order_ledger.order.OrderLine;
import lombok.Value;

/**
 * A line was appended to an order that was still CREATED.
 */
@Value
public class ItemAdded implements OrderEventPayload {
    OrderLine item;

    public static final String EVENT_TYPE = "ItemAdded";

    @Override
    public OrderEventType type() {
        return OrderEventType.ITEM_ADDED;
    }
}
