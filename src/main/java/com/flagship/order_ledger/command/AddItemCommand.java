package com.flagship.order_ledger.command;

import com.flagship.order_ledger.order.OrderLine;
import lombok.Value;

import java.util.UUID;

@Value
public class AddItemCommand implements OrderCommand {
    UUID commandId;
    UUID orderId;
    OrderLine item;

    public static AddItemCommand of(UUID orderId, OrderLine item) {
        return new AddItemCommand(UUID.randomUUID(), orderId, item);
    }

    @Override
    public CommandType type() {
        return CommandType.ADD_ITEM;
    }
}
