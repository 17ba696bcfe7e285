package com.flagship.order_ledger.integration;

import com.flagship.order_ledger.order.CurrencyCode;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class OrderNotification {
    UUID orderId;
    UUID customerId;
    BigDecimal totalAmount;
    CurrencyCode currency;
    String notificationToken;

    /**
     * Token for the fact at the given stream position.
     */
    public static String tokenFor(UUID orderId, long sequenceNumber) {
        return orderId + ":" + sequenceNumber;
    }
}
