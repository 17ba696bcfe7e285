package com.flagship.order_ledger.query;

import com.flagship.order_ledger.order.OrderStatus;
import lombok.Value;

import java.util.UUID;

/**
 * Search criteria for order summaries. Null fields match everything.
 */
@Value
public class OrderSummaryFilter {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 500;

    UUID customerId;
    OrderStatus status;
    int limit;

    public OrderSummaryFilter(UUID customerId, OrderStatus status, int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("Limit must be between 1 and " + MAX_LIMIT + ", got " + limit);
        }
        this.customerId = customerId;
        this.status = status;
        this.limit = limit;
    }

    public static OrderSummaryFilter all() {
        return new OrderSummaryFilter(null, null, DEFAULT_LIMIT);
    }
}
