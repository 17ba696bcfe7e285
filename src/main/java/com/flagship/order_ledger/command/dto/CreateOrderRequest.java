package com.flagship.order_ledger.command.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Request DTO for opening an order.
 */
@Value
public class CreateOrderRequest {

    @NotNull(message = "Customer ID is required")
    @JsonProperty("customer_id")
    UUID customerId;

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "^[A-Za-z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;

    @NotEmpty(message = "At least one item is required")
    @JsonProperty("items")
    List<@NotNull(message = "Item is required") @Valid OrderItemRequest> items;
}
