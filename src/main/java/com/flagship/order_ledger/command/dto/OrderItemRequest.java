package com.flagship.order_ledger.command.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.order_ledger.order.OrderLine;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One order line as sent by clients. Also the body of POST /api/orders/{id}/items.
 */
@Value
public class OrderItemRequest {

    @NotBlank(message = "Product ID is required")
    @JsonProperty("product_id")
    String productId;

    @Min(value = 1, message = "Quantity must be at least 1")
    @JsonProperty("quantity")
    int quantity;

    @NotNull(message = "Unit price is required")
    @DecimalMin(value = "0.00", message = "Unit price must not be negative")
    @JsonProperty("unit_price")
    BigDecimal unitPrice;

    public OrderLine toOrderLine() {
        return OrderLine.of(productId, quantity, unitPrice);
    }
}
