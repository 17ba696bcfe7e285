package com.flagship.order_ledger.order.event;

import lombok.Value;

import java.math.BigDecimal;

/**
 * The order was confirmed after its total was authorized.
 *
 * Carries the gateway's transaction ID so the fact can be correlated with
 * the charge, and the total that was authorized.
 */
@Value
public class OrderConfirmed implements OrderEventPayload {
    String paymentReference;
    BigDecimal authorizedAmount;

    public static final String EVENT_TYPE = "OrderConfirmed";

    @Override
    public OrderEventType type() {
        return OrderEventType.ORDER_CONFIRMED;
    }
}
