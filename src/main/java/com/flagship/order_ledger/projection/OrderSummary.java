package com.flagship.order_ledger.projection;

import com.flagship.order_ledger.order.CurrencyCode;
import com.flagship.order_ledger.order.OrderStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One row of the order summary read model.
 *
 * Every field is a function of the order's events (plus the customer's
 * display name), so a row rebuilt from sequence 1 equals the row built
 * incrementally. lastAppliedSequence is the deduplication watermark.
 */
@Value
public class OrderSummary {
    UUID id;
    UUID customerId;
    String customerName;
    CurrencyCode currency;
    BigDecimal totalAmount;
    int itemCount;
    OrderStatus status;
    Instant createdAt;
    Instant updatedAt;
    long lastAppliedSequence;
}
