package com.flagship.order_ledger.command;

import com.flagship.order_ledger.eventstore.EventStore;
import com.flagship.order_ledger.integration.NotificationPort;
import com.flagship.order_ledger.integration.OrderNotification;
import com.flagship.order_ledger.integration.PaymentAuthorization;
import com.flagship.order_ledger.integration.PaymentGateway;
import com.flagship.order_ledger.integration.PaymentReceipt;
import com.flagship.order_ledger.observability.CorrelationContext;
import com.flagship.order_ledger.observability.OrderMetrics;
import com.flagship.order_ledger.order.Order;
import com.flagship.order_ledger.order.event.OrderEvent;
import com.flagship.order_ledger.order.event.OrderEventPayload;
import com.flagship.order_ledger.order.event.OrderEventType;
import com.flagship.order_ledger.order.exception.ConcurrencyConflictException;
import com.flagship.order_ledger.order.exception.CorruptStreamException;
import com.flagship.order_ledger.order.exception.InvariantViolationException;
import com.flagship.order_ledger.order.exception.OrderValidationException;
import com.flagship.order_ledger.order.exception.PaymentDeclinedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.function.Function;

/**
 * Runs one command against one order: load, replay, decide, append.
 *
 * Key design decisions:
 * - Not transactional. The only write is the store's atomic append, so a
 *   command abandoned at any point before it leaves nothing behind
 * - A concurrency conflict restarts from a fresh load, so business rules are
 *   re-checked against the state that actually won. Retries are bounded with
 *   exponential backoff, and exhaustion rethrows the conflict
 * - Never writes the read model and never waits for it
 * - Payment authorization uses the command ID as its attempt token, so a
 *   retried confirm reuses the first hold instead of placing another
 * - Notifications are sent once per appended fact, after the append succeeded
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderCommandHandler {

    private final EventStore eventStore;
    private final PaymentGateway paymentGateway;
    private final NotificationPort notificationPort;
    private final RetryPolicy retryPolicy;
    private final OrderMetrics metrics;
    private final Clock clock;

    /**
     * Dispatches any order command.
     *
     * @return the order ID and the version after the command
     * @throws OrderValidationException if the command input is invalid
     * @throws InvariantViolationException if the order's state forbids the command
     * @throws ConcurrencyConflictException if every retry lost a race
     * @throws CorruptStreamException if the order's stream cannot be replayed
     */
    public CommandResult handle(OrderCommand command) {
        long startTime = System.nanoTime();
        String commandType = command.type().name();

        MDC.put(CorrelationContext.ORDER_ID_MDC_KEY, String.valueOf(command.getOrderId()));
        MDC.put(CorrelationContext.COMMAND_TYPE_MDC_KEY, commandType);
        try {
            CommandResult result = switch (command.type()) {
                case CREATE_ORDER -> create((CreateOrderCommand) command);
                case ADD_ITEM -> addItem((AddItemCommand) command);
                case CONFIRM_ORDER -> confirm((ConfirmOrderCommand) command);
                case CANCEL_ORDER -> cancel((CancelOrderCommand) command);
            };

            metrics.recordCommand(commandType,
                    result.isNoOp() ? OrderMetrics.OUTCOME_NO_OP : OrderMetrics.OUTCOME_APPENDED,
                    elapsedSince(startTime));
            log.info("Command handled: type={}, orderId={}, version={}, appended={}",
                    commandType, result.getAggregateId(), result.getResultingVersion(),
                    result.getAppendedEvents().size());
            return result;

        } catch (OrderValidationException | InvariantViolationException e) {
            metrics.recordCommand(commandType, OrderMetrics.OUTCOME_REJECTED, elapsedSince(startTime));
            log.info("Command rejected: type={}, orderId={}, reason={}",
                    commandType, command.getOrderId(), e.getMessage());
            throw e;
        } catch (ConcurrencyConflictException e) {
            metrics.recordCommand(commandType, OrderMetrics.OUTCOME_CONFLICT, elapsedSince(startTime));
            throw e;
        } catch (CorruptStreamException e) {
            metrics.recordCommand(commandType, OrderMetrics.OUTCOME_CORRUPT, elapsedSince(startTime));
            log.error("Refusing command on corrupt stream: type={}, orderId={}", commandType, command.getOrderId(), e);
            throw e;
        } catch (RuntimeException e) {
            metrics.recordCommand(commandType, OrderMetrics.OUTCOME_ERROR, elapsedSince(startTime));
            log.error("Command failed: type={}, orderId={}, error={}", commandType, command.getOrderId(), e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.ORDER_ID_MDC_KEY);
            MDC.remove(CorrelationContext.COMMAND_TYPE_MDC_KEY);
        }
    }

    private CommandResult create(CreateOrderCommand command) {
        Execution execution = execute(command, order -> {
            // A repeated keyed create finds its own order and does nothing
            if (command.isIdempotent() && order.exists()) {
                return List.of();
            }
            return order.create(command.getCustomerId(), command.getCurrency(), command.getItems());
        });
        notifyAppended(execution);
        return execution.result();
    }

    private CommandResult addItem(AddItemCommand command) {
        return execute(command, order -> order.addItem(command.getItem())).result();
    }

    private CommandResult confirm(ConfirmOrderCommand command) {
        Execution execution = execute(command, order -> {
            if (!order.needsConfirmation()) {
                return List.of();
            }
            PaymentReceipt receipt = paymentGateway.authorize(new PaymentAuthorization(
                    order.getId(), order.getTotalAmount(), order.getCurrency(),
                    command.getCommandId().toString()));
            if (!receipt.isApproved()) {
                throw new PaymentDeclinedException(order.getId(), receipt.getDeclineReason());
            }
            return order.confirm(receipt.getTransactionId());
        });
        notifyAppended(execution);
        return execution.result();
    }

    private CommandResult cancel(CancelOrderCommand command) {
        return execute(command, order -> order.cancel(command.getReason())).result();
    }

    /**
     * The load-decide-append loop shared by every command.
     */
    private Execution execute(OrderCommand command, Function<Order, List<OrderEventPayload>> decision) {
        UUID orderId = command.getOrderId();
        if (orderId == null) {
            throw new OrderValidationException("Order ID is required");
        }

        int attempt = 0;
        while (true) {
            attempt++;
            Order order = Order.replay(orderId, eventStore.loadStream(orderId));
            List<OrderEventPayload> payloads = decision.apply(order);

            if (payloads.isEmpty()) {
                return new Execution(CommandResult.noOp(orderId, order.getVersion()), order);
            }

            try {
                List<OrderEvent> appended = eventStore.append(orderId, order.getVersion(), payloads, clock.instant());
                Order resulting = order;
                for (OrderEvent event : appended) {
                    resulting = resulting.apply(event);
                }
                return new Execution(new CommandResult(orderId, resulting.getVersion(), appended), resulting);

            } catch (ConcurrencyConflictException e) {
                if (!retryPolicy.hasAttemptsLeft(attempt)) {
                    metrics.recordConflictExhausted();
                    log.warn("Giving up after {} conflicting attempts: type={}, orderId={}",
                            attempt, command.type(), orderId);
                    throw e;
                }
                metrics.recordConcurrencyRetry(command.type().name());
                Duration backoff = retryPolicy.backoffAfter(attempt);
                log.debug("Concurrency conflict on attempt {}, retrying in {}ms: orderId={}, expectedVersion={}",
                        attempt, backoff.toMillis(), orderId, e.getExpectedVersion());
                sleep(backoff, e);
            }
        }
    }

    private void sleep(Duration backoff, ConcurrencyConflictException conflict) {
        if (backoff.isZero()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            conflict.addSuppressed(interrupted);
            throw conflict;
        }
    }

    private void notifyAppended(Execution execution) {
        Order order = execution.order();
        for (OrderEvent event : execution.result().getAppendedEvents()) {
            OrderNotification notification = new OrderNotification(
                    order.getId(), order.getCustomerId(), order.getTotalAmount(), order.getCurrency(),
                    OrderNotification.tokenFor(event.getAggregateId(), event.getSequenceNumber()));
            try {
                if (event.getType() == OrderEventType.ORDER_CREATED) {
                    notificationPort.orderCreated(notification);
                } else if (event.getType() == OrderEventType.ORDER_CONFIRMED) {
                    notificationPort.orderConfirmed(notification);
                }
            } catch (RuntimeException e) {
                // The fact is already durable; a lost notification must not fail the command
                log.warn("Notification failed: orderId={}, sequence={}, error={}",
                        event.getAggregateId(), event.getSequenceNumber(), e.getMessage());
            }
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /**
     * A command's result together with the order state it left behind.
     */
    private record Execution(CommandResult result, Order order) {}
}
