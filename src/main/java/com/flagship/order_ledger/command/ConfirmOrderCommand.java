package com.flagship.order_ledger.command;

import lombok.Value;

import java.util.UUID;

/**
 * Authorizes the order total and confirms the order.
 */
@Value
public class ConfirmOrderCommand implements OrderCommand {
    UUID commandId;
    UUID orderId;

    public static ConfirmOrderCommand of(UUID orderId) {
        return new ConfirmOrderCommand(UUID.randomUUID(), orderId);
    }

    @Override
    public CommandType type() {
        return CommandType.CONFIRM_ORDER;
    }
}
