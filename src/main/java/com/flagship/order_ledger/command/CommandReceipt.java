package com.flagship.order_ledger.command;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * The first result recorded under an idempotency key.
 */
@Value
public class CommandReceipt {
    String idempotencyKey;
    CommandType commandType;
    UUID aggregateId;
    long resultingVersion;
    Instant createdAt;

    public static CommandReceipt of(String idempotencyKey, CommandType commandType, CommandResult result) {
        return new CommandReceipt(idempotencyKey, commandType,
                result.getAggregateId(), result.getResultingVersion(), Instant.now());
    }

    public CommandResult toResult() {
        return CommandResult.noOp(aggregateId, resultingVersion);
    }
}
