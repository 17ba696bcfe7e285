package com.flagship.order_ledger.query.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.order_ledger.order.OrderStatus;
import com.flagship.order_ledger.projection.OrderSummary;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for order summary queries.
 */
@Value
@Builder
public class OrderSummaryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("customer_name")
    String customerName;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("item_count")
    int itemCount;

    @JsonProperty("status")
    OrderStatus status;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonProperty("version")
    long version;

    public static OrderSummaryResponse from(OrderSummary summary) {
        return OrderSummaryResponse.builder()
            .id(summary.getId())
            .customerId(summary.getCustomerId())
            .customerName(summary.getCustomerName())
            .currency(summary.getCurrency().name())
            .totalAmount(summary.getTotalAmount())
            .itemCount(summary.getItemCount())
            .status(summary.getStatus())
            .createdAt(summary.getCreatedAt())
            .updatedAt(summary.getUpdatedAt())
            .version(summary.getLastAppliedSequence())
            .build();
    }
}
