package com.flagship.order_ledger.order;

import com.flagship.order_ledger.order.event.ItemAdded;
import com.flagship.order_ledger.order.event.OrderCancelled;
import com.flagship.order_ledger.order.event.OrderConfirmed;
import com.flagship.order_ledger.order.event.OrderCreated;
import com.flagship.order_ledger.order.event.OrderEvent;
import com.flagship.order_ledger.order.event.OrderEventPayload;
import com.flagship.order_ledger.order.exception.CorruptStreamException;
import com.flagship.order_ledger.order.exception.InvariantViolationException;
import com.flagship.order_ledger.order.exception.OrderNotFoundException;
import com.flagship.order_ledger.order.exception.OrderValidationException;
import lombok.Value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Order aggregate state, derived entirely from its event stream.
 *
 * Key principles:
 * - Never persisted; rebuilt by folding events with {@link #apply(OrderEvent)}
 * - Decision methods (create, addItem, confirm, cancel) validate against the
 *   current state and return the facts to append; they never change state
 * - apply is a pure function, so replaying the same stream always gives the same Order
 * - totalAmount always equals the sum of unitPrice × quantity over items
 */
@Value
public class Order {
    UUID id;
    UUID customerId;
    CurrencyCode currency;
    OrderStatus status;
    List<OrderLine> items;
    BigDecimal totalAmount;
    String paymentReference;
    long version;

    /**
     * The state before any event: no status, version 0.
     */
    public static Order empty(UUID id) {
        if (id == null) {
            throw new IllegalArgumentException("Order ID cannot be null");
        }
        return new Order(id, null, null, null, List.of(), BigDecimal.ZERO, null, 0L);
    }

    /**
     * Rebuilds an order by folding its stream from the empty state.
     *
     * @throws CorruptStreamException on a gap, a duplicate or an out-of-order event
     */
    public static Order replay(UUID id, List<OrderEvent> events) {
        Order order = empty(id);
        for (OrderEvent event : events) {
            order = order.apply(event);
        }
        return order;
    }

    public boolean exists() {
        return status != null;
    }

    // ==================== Decisions ====================

    /**
     * Opens a new order.
     *
     * @throws OrderValidationException if the customer, currency or any line is invalid, there are no lines,
     *         or the total would not fit the read model
     * @throws InvariantViolationException if this order already exists
     */
    public List<OrderEventPayload> create(UUID customerId, CurrencyCode currency, List<OrderLine> lines) {
        if (customerId == null) {
            throw new OrderValidationException("Customer ID is required");
        }
        if (currency == null) {
            throw new OrderValidationException("Currency is required");
        }
        if (lines == null || lines.isEmpty()) {
            throw new OrderValidationException("An order needs at least one item");
        }
        for (OrderLine line : lines) {
            if (line == null) {
                throw new OrderValidationException("Item is required");
            }
            line.validate();
        }
        requireWithinMaxAmount(sum(lines));

        if (exists()) {
            throw new InvariantViolationException(id,
                String.format("Order %s already exists at version %d", id, version));
        }
        return List.of(new OrderCreated(customerId, currency, List.copyOf(lines)));
    }

    /**
     * Adds a line to an order that is still CREATED.
     *
     * @throws OrderValidationException if the line is invalid or the new total would not fit the read model
     * @throws OrderNotFoundException if the order does not exist
     * @throws InvariantViolationException if the order is confirmed or cancelled
     */
    public List<OrderEventPayload> addItem(OrderLine line) {
        if (line == null) {
            throw new OrderValidationException("Item is required");
        }
        line.validate();
        requireExists();
        if (status != OrderStatus.CREATED) {
            throw new InvariantViolationException(id,
                String.format("Cannot add items to order in %s status. Only CREATED orders accept items.", status));
        }
        requireWithinMaxAmount(totalAmount.add(line.lineTotal()));
        return List.of(new ItemAdded(line));
    }

    /**
     * Checks whether confirm would produce a fact.
     *
     * @return false if the order is already CONFIRMED, true if it is CREATED and confirmable
     * @throws OrderNotFoundException if the order does not exist
     * @throws InvariantViolationException if the order is cancelled or has no items
     */
    public boolean needsConfirmation() {
        requireExists();
        if (status == OrderStatus.CONFIRMED) {
            return false;
        }
        if (status != OrderStatus.CREATED) {
            throw new InvariantViolationException(id,
                String.format("Cannot confirm order in %s status. Only CREATED orders can be confirmed.", status));
        }
        if (items.isEmpty()) {
            throw new InvariantViolationException(id, "Cannot confirm an order without items");
        }
        return true;
    }

    /**
     * Confirms the order. Confirming an already CONFIRMED order yields no facts.
     */
    public List<OrderEventPayload> confirm(String paymentReference) {
        if (!needsConfirmation()) {
            return List.of();
        }
        return List.of(new OrderConfirmed(paymentReference, totalAmount));
    }

    /**
     * Cancels the order. Cancelling an already CANCELLED order yields no facts.
     *
     * @throws OrderNotFoundException if the order does not exist
     * @throws InvariantViolationException if the order is already confirmed
     */
    public List<OrderEventPayload> cancel(String reason) {
        requireExists();
        if (status == OrderStatus.CANCELLED) {
            return List.of();
        }
        if (status != OrderStatus.CREATED) {
            throw new InvariantViolationException(id,
                String.format("Cannot cancel order in %s status. Only CREATED orders can be cancelled.", status));
        }
        return List.of(new OrderCancelled(reason));
    }

    // ==================== Fold ====================

    /**
     * Returns the state after one more event.
     *
     * @throws CorruptStreamException if the event belongs to another order, is not
     *         exactly the next sequence number, cannot be interpreted, or does not
     *         fit the current status
     */
    public Order apply(OrderEvent event) {
        if (!id.equals(event.getAggregateId())) {
            throw new CorruptStreamException(id,
                "event " + event.getEventId() + " belongs to order " + event.getAggregateId());
        }
        long expected = version + 1;
        if (event.getSequenceNumber() != expected) {
            throw new CorruptStreamException(id,
                String.format("expected sequence %d but found %d", expected, event.getSequenceNumber()));
        }
        long next = event.getSequenceNumber();

        return switch (event.getType()) {
            case ORDER_CREATED -> {
                if (exists()) {
                    throw new CorruptStreamException(id, "OrderCreated at sequence " + next + " after creation");
                }
                OrderCreated created = (OrderCreated) event.getPayload();
                yield new Order(id, created.getCustomerId(), created.getCurrency(), OrderStatus.CREATED,
                        List.copyOf(created.getItems()), sum(created.getItems()), null, next);
            }
            case ITEM_ADDED -> {
                requireStatusInStream(OrderStatus.CREATED, event);
                List<OrderLine> lines = new ArrayList<>(items);
                lines.add(((ItemAdded) event.getPayload()).getItem());
                yield new Order(id, customerId, currency, status,
                        Collections.unmodifiableList(lines), sum(lines), paymentReference, next);
            }
            case ORDER_CONFIRMED -> {
                requireStatusInStream(OrderStatus.CREATED, event);
                OrderConfirmed confirmed = (OrderConfirmed) event.getPayload();
                yield new Order(id, customerId, currency, OrderStatus.CONFIRMED,
                        items, totalAmount, confirmed.getPaymentReference(), next);
            }
            case ORDER_CANCELLED -> {
                requireStatusInStream(OrderStatus.CREATED, event);
                yield new Order(id, customerId, currency, OrderStatus.CANCELLED,
                        items, totalAmount, paymentReference, next);
            }
            case UNRECOGNIZED -> throw new CorruptStreamException(id,
                String.format("unrecognized event type at sequence %d", next));
        };
    }

    private void requireExists() {
        if (!exists()) {
            throw new OrderNotFoundException(id);
        }
    }

    private static void requireWithinMaxAmount(BigDecimal total) {
        if (total.compareTo(OrderLine.MAX_AMOUNT) > 0) {
            throw new OrderValidationException(
                "Order total would exceed " + OrderLine.MAX_AMOUNT.toPlainString() + ", got " + total.toPlainString());
        }
    }

    private void requireStatusInStream(OrderStatus required, OrderEvent event) {
        if (status != required) {
            throw new CorruptStreamException(id,
                String.format("%s at sequence %d while order is %s",
                    event.getType(), event.getSequenceNumber(), status));
        }
    }

    private static BigDecimal sum(List<OrderLine> lines) {
        return lines.stream()
                .map(OrderLine::lineTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
