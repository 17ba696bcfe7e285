package com.flagship.order_ledger.projection;

import com.flagship.order_ledger.order.OrderLine;
import com.flagship.order_ledger.order.OrderStatus;
import com.flagship.order_ledger.order.event.ItemAdded;
import com.flagship.order_ledger.order.event.OrderCreated;
import com.flagship.order_ledger.order.event.OrderEvent;

import java.math.BigDecimal;
import java.util.UUID;
import java.util.function.Function;

/**
 * Maps each event type to its read-model mutation.
 *
 * OrderCreated inserts, ItemAdded updates the total, OrderConfirmed and
 * OrderCancelled update the status. Unrecognized events only move the
 * watermark. Timestamps come from the events, never from the clock.
 */
public final class OrderSummaryFold {

    private OrderSummaryFold() {
        // Utility class
    }

    /**
     * Applies the next event to a row.
     *
     * @param current the row before the event, or null if none exists yet
     * @param customerNames resolves a customer's display name when a row is created
     * @return the row after the event, or null if there is still nothing to store
     * @throws IllegalStateException if the event does not follow the row's watermark
     *         or needs a row that does not exist
     */
    public static OrderSummary apply(OrderSummary current, OrderEvent event,
                                     Function<UUID, String> customerNames) {
        long watermark = current == null ? 0L : current.getLastAppliedSequence();
        if (event.getSequenceNumber() != watermark + 1) {
            throw new IllegalStateException(String.format(
                "Event %d of order %s does not follow watermark %d",
                event.getSequenceNumber(), event.getAggregateId(), watermark));
        }

        return switch (event.getType()) {
            case ORDER_CREATED -> {
                if (current != null) {
                    throw new IllegalStateException("Summary already exists for order " + event.getAggregateId());
                }
                OrderCreated created = (OrderCreated) event.getPayload();
                BigDecimal total = created.getItems().stream()
                        .map(OrderLine::lineTotal)
                        .reduce(BigDecimal.ZERO, BigDecimal::add);
                yield new OrderSummary(
                    event.getAggregateId(),
                    created.getCustomerId(),
                    customerNames.apply(created.getCustomerId()),
                    created.getCurrency(),
                    total,
                    created.getItems().size(),
                    OrderStatus.CREATED,
                    event.getOccurredAt(),
                    event.getOccurredAt(),
                    event.getSequenceNumber()
                );
            }
            case ITEM_ADDED -> {
                OrderSummary row = requireRow(current, event);
                OrderLine line = ((ItemAdded) event.getPayload()).getItem();
                yield new OrderSummary(row.getId(), row.getCustomerId(), row.getCustomerName(), row.getCurrency(),
                        row.getTotalAmount().add(line.lineTotal()), row.getItemCount() + 1, row.getStatus(),
                        row.getCreatedAt(), event.getOccurredAt(), event.getSequenceNumber());
            }
            case ORDER_CONFIRMED -> withStatus(requireRow(current, event), OrderStatus.CONFIRMED, event);
            case ORDER_CANCELLED -> withStatus(requireRow(current, event), OrderStatus.CANCELLED, event);
            case UNRECOGNIZED -> current == null ? null : advance(current, event);
        };
    }

    /**
     * Moves the watermark past an event without touching any other field.
     */
    public static OrderSummary advance(OrderSummary row, OrderEvent event) {
        return new OrderSummary(row.getId(), row.getCustomerId(), row.getCustomerName(), row.getCurrency(),
                row.getTotalAmount(), row.getItemCount(), row.getStatus(),
                row.getCreatedAt(), row.getUpdatedAt(), event.getSequenceNumber());
    }

    private static OrderSummary withStatus(OrderSummary row, OrderStatus status, OrderEvent event) {
        return new OrderSummary(row.getId(), row.getCustomerId(), row.getCustomerName(), row.getCurrency(),
                row.getTotalAmount(), row.getItemCount(), status,
                row.getCreatedAt(), event.getOccurredAt(), event.getSequenceNumber());
    }

    private static OrderSummary requireRow(OrderSummary current, OrderEvent event) {
        if (current == null) {
            throw new IllegalStateException(String.format(
                "%s at sequence %d but order %s has no summary row",
                event.getType(), event.getSequenceNumber(), event.getAggregateId()));
        }
        return current;
    }
}
