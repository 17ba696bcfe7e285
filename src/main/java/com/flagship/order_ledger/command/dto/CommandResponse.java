package com.flagship.order_ledger.command.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.order_ledger.command.CommandResult;
import com.flagship.order_ledger.order.event.OrderEvent;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Response DTO for every command endpoint.
 *
 * version is the stream version after the command. The read model catches
 * up to it asynchronously.
 */
@Value
@Builder
public class CommandResponse {

    @JsonProperty("order_id")
    UUID orderId;

    @JsonProperty("version")
    long version;

    @JsonProperty("appended_events")
    List<String> appendedEvents;

    public static CommandResponse from(CommandResult result) {
        return CommandResponse.builder()
            .orderId(result.getAggregateId())
            .version(result.getResultingVersion())
            .appendedEvents(result.getAppendedEvents().stream()
                .map(OrderEvent::getType)
                .map(Enum::name)
                .toList())
            .build();
    }
}
