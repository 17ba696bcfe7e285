package com.flagship.order_ledger.command;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the command_receipts table.
 *
 * The primary key on idempotency_key makes the first writer win.
 */
@Entity
@Table(name = "command_receipts")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class CommandReceiptEntity {

    @Id
    @Column(name = "idempotency_key", nullable = false, updatable = false, length = 255)
    private String idempotencyKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "command_type", nullable = false, length = 50)
    private CommandType commandType;

    @Column(name = "aggregate_id", nullable = false)
    private UUID aggregateId;

    @Column(name = "resulting_version", nullable = false)
    private long resultingVersion;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public static CommandReceiptEntity fromDomain(CommandReceipt receipt) {
        return new CommandReceiptEntity(
            receipt.getIdempotencyKey(),
            receipt.getCommandType(),
            receipt.getAggregateId(),
            receipt.getResultingVersion(),
            receipt.getCreatedAt()
        );
    }

    public CommandReceipt toDomain() {
        return new CommandReceipt(
            this.idempotencyKey,
            this.commandType,
            this.aggregateId,
            this.resultingVersion,
            this.createdAt
        );
    }
}
