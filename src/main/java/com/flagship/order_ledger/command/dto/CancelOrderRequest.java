package com.flagship.order_ledger.command.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class CancelOrderRequest {

    @Size(max = 500, message = "Reason must be at most 500 characters")
    @JsonProperty("reason")
    String reason;
}
