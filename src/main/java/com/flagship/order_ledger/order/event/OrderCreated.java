package com.flagship.order_ledger.order.event;

import com.flagship.order_ledger.order.CurrencyCode;
import com.flagship.order_ledger.order.OrderLine;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * First fact of every order stream (sequence 1).
 */
@Value
public class OrderCreated implements OrderEventPayload {
    UUID customerId;
    CurrencyCode currency;
    List<OrderLine> items;

    public static final String EVENT_TYPE = "OrderCreated";

    @Override
    public OrderEventType type() {
        return OrderEventType.ORDER_CREATED;
    }
}
