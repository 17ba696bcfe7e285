package com.flagship.order_ledger.command;

import com.flagship.order_ledger.eventstore.EventStore;
import com.flagship.order_ledger.eventstore.InMemoryEventStore;
import com.flagship.order_ledger.integration.NotificationPort;
import com.flagship.order_ledger.integration.OrderNotification;
import com.flagship.order_ledger.integration.PaymentAuthorization;
import com.flagship.order_ledger.integration.PaymentGateway;
import com.flagship.order_ledger.integration.PaymentReceipt;
import com.flagship.order_ledger.observability.OrderMetrics;
import com.flagship.order_ledger.order.CurrencyCode;
import com.flagship.order_ledger.order.Order;
import com.flagship.order_ledger.order.OrderLine;
import com.flagship.order_ledger.order.OrderStatus;
import com.flagship.order_ledger.order.event.OrderCreated;
import com.flagship.order_ledger.order.event.OrderEvent;
import com.flagship.order_ledger.order.event.OrderEventType;
import com.flagship.order_ledger.order.event.UnrecognizedEvent;
import com.flagship.order_ledger.order.exception.ConcurrencyConflictException;
import com.flagship.order_ledger.order.exception.CorruptStreamException;
import com.flagship.order_ledger.order.exception.InvariantViolationException;
import com.flagship.order_ledger.order.exception.OrderNotFoundException;
import com.flagship.order_ledger.order.exception.OrderValidationException;
import com.flagship.order_ledger.order.exception.PaymentDeclinedException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the command handler over the in-memory store, with the payment
 * gateway and notification port mocked.
 *
 * These tests verify that:
 * - Each command appends the right facts, or nothing when it is a no-op
 * - Conflicts are retried from a fresh load and surface once retries run out
 * - Corrupt streams surface at once, without retry
 * - Payment and notification tokens are stable
 */
class OrderCommandHandlerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private EventStore store;
    private PaymentGateway paymentGateway;
    private NotificationPort notificationPort;
    private SimpleMeterRegistry meterRegistry;
    private OrderCommandHandler handler;
    private UUID customerId;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventStore(event -> { });
        paymentGateway = mock(PaymentGateway.class);
        notificationPort = mock(NotificationPort.class);
        meterRegistry = new SimpleMeterRegistry();
        when(paymentGateway.authorize(any())).thenAnswer(invocation ->
                PaymentReceipt.approved("auth-" + ((PaymentAuthorization) invocation.getArgument(0)).getAttemptToken()));
        handler = handlerFor(store);
        customerId = UUID.randomUUID();
    }

    private OrderCommandHandler handlerFor(EventStore eventStore) {
        return new OrderCommandHandler(eventStore, paymentGateway, notificationPort,
                new RetryPolicy(5, 0, 0), new OrderMetrics(meterRegistry),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private static OrderLine line(String productId, int quantity, String unitPrice) {
        return OrderLine.of(productId, quantity, new BigDecimal(unitPrice));
    }

    private UUID createOrder() {
        return handler.handle(CreateOrderCommand.of(customerId, CurrencyCode.JPY, List.of(line("P1", 2, "10.00"))))
                .getAggregateId();
    }

    @Nested
    @DisplayName("Command outcomes")
    class CommandOutcomes {

        @Test
        @DisplayName("Create with [(P1, 2, 10.00)] appends OrderCreated at sequence 1 with total 20.00")
        void testCreate_AppendsOrderCreated() {
            printTestHeader("Create - Appends OrderCreated");

            CommandResult result = handler.handle(
                    CreateOrderCommand.of(customerId, CurrencyCode.JPY, List.of(line("P1", 2, "10.00"))));

            System.out.println("Order ID: " + result.getAggregateId() + ", version: " + result.getResultingVersion());

            assertEquals(1, result.getResultingVersion());
            assertEquals(1, result.getAppendedEvents().size());
            OrderEvent event = result.getAppendedEvents().get(0);
            assertEquals(OrderEventType.ORDER_CREATED, event.getType());
            assertEquals(1, event.getSequenceNumber());
            assertEquals(NOW, event.getOccurredAt());

            Order order = Order.replay(result.getAggregateId(), store.loadStream(result.getAggregateId()));
            assertEquals(OrderStatus.CREATED, order.getStatus());
            assertEquals(0, new BigDecimal("20.00").compareTo(order.getTotalAmount()));

            printSuccess("OrderCreated at sequence 1");
        }

        @Test
        @DisplayName("Add, confirm and cancel flow through to the stream")
        void testFullLifecycle() {
            printTestHeader("Full Lifecycle");

            UUID orderId = createOrder();
            assertEquals(2, handler.handle(AddItemCommand.of(orderId, line("P2", 1, "5.00"))).getResultingVersion());
            CommandResult confirmed = handler.handle(ConfirmOrderCommand.of(orderId));

            assertEquals(3, confirmed.getResultingVersion());
            Order order = Order.replay(orderId, store.loadStream(orderId));
            assertEquals(OrderStatus.CONFIRMED, order.getStatus());
            assertEquals(0, new BigDecimal("25.00").compareTo(order.getTotalAmount()));
            assertNotNull(order.getPaymentReference());

            assertThrows(InvariantViolationException.class,
                    () -> handler.handle(CancelOrderCommand.of(orderId, "too late")));
            assertThrows(InvariantViolationException.class,
                    () -> handler.handle(AddItemCommand.of(orderId, line("P3", 1, "1.00"))));

            printSuccess("Lifecycle enforced");
        }

        @Test
        @DisplayName("A repeated confirm is a no-op and does not authorize again")
        void testRepeatedConfirm_NoOp() {
            printTestHeader("Repeated Confirm - No-Op");

            UUID orderId = createOrder();
            handler.handle(ConfirmOrderCommand.of(orderId));
            CommandResult second = handler.handle(ConfirmOrderCommand.of(orderId));

            assertTrue(second.isNoOp());
            assertEquals(2, second.getResultingVersion());
            verify(paymentGateway, times(1)).authorize(any());

            printSuccess("Second confirm appended nothing");
        }

        @Test
        @DisplayName("A keyed create repeated with the same key lands on the same order and appends nothing")
        void testKeyedCreate_Idempotent() {
            printTestHeader("Keyed Create - Idempotent");

            CreateOrderCommand first = CreateOrderCommand.withIdempotencyKey("key-1", customerId,
                    CurrencyCode.JPY, List.of(line("P1", 1, "1.00")));
            CreateOrderCommand repeat = CreateOrderCommand.withIdempotencyKey("key-1", customerId,
                    CurrencyCode.JPY, List.of(line("P1", 1, "1.00")));

            CommandResult firstResult = handler.handle(first);
            CommandResult repeatResult = handler.handle(repeat);

            assertEquals(firstResult.getAggregateId(), repeatResult.getAggregateId());
            assertTrue(repeatResult.isNoOp());
            assertEquals(1, store.loadStream(firstResult.getAggregateId()).size());

            printSuccess("Same key, one order");
        }

        @Test
        @DisplayName("Commands on a missing order or with invalid input are rejected")
        void testRejections() {
            printTestHeader("Rejections");

            assertThrows(OrderNotFoundException.class, () -> handler.handle(ConfirmOrderCommand.of(UUID.randomUUID())));
            assertThrows(OrderValidationException.class, () -> handler.handle(
                    CreateOrderCommand.of(customerId, CurrencyCode.JPY, List.of())));

            assertEquals(2.0, meterRegistry.counter("orders.commands",
                    "command", "CONFIRM_ORDER", "outcome", OrderMetrics.OUTCOME_REJECTED).count()
                    + meterRegistry.counter("orders.commands",
                    "command", "CREATE_ORDER", "outcome", OrderMetrics.OUTCOME_REJECTED).count());

            printSuccess("Rejected and counted");
        }

        @Test
        @DisplayName("A missing line in a create is a rejection, not a failure")
        void testNullLine_Rejected() {
            printTestHeader("Null Line Rejected");

            List<OrderLine> lines = Arrays.asList(line("P1", 1, "1.00"), null);

            OrderValidationException e = assertThrows(OrderValidationException.class,
                    () -> handler.handle(CreateOrderCommand.of(customerId, CurrencyCode.USD, lines)));

            assertEquals("Item is required", e.getMessage());
            assertEquals(1.0, meterRegistry.counter("orders.commands",
                    "command", "CREATE_ORDER", "outcome", OrderMetrics.OUTCOME_REJECTED).count());
            assertEquals(0.0, meterRegistry.counter("orders.commands",
                    "command", "CREATE_ORDER", "outcome", OrderMetrics.OUTCOME_ERROR).count());

            printSuccess("Counted as rejected");
        }

        @Test
        @DisplayName("A declined payment leaves the order CREATED")
        void testPaymentDeclined() {
            printTestHeader("Payment Declined");

            UUID orderId = createOrder();
            when(paymentGateway.authorize(any())).thenReturn(PaymentReceipt.declined("insufficient funds"));

            PaymentDeclinedException e = assertThrows(PaymentDeclinedException.class,
                    () -> handler.handle(ConfirmOrderCommand.of(orderId)));

            assertEquals("insufficient funds", e.getDeclineReason());
            assertEquals(1, store.loadStream(orderId).size());

            printSuccess("Decline appended nothing");
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("Two concurrent confirms at version 1: one appends sequence 2, the other becomes a no-op")
        void testConcurrentConfirms() throws Exception {
            printTestHeader("Concurrent Confirms");

            UUID orderId = createOrder();

            // Hold both commands inside authorization until both have read version 1
            CyclicBarrier bothLoaded = new CyclicBarrier(2);
            when(paymentGateway.authorize(any())).thenAnswer(invocation -> {
                try {
                    bothLoaded.await(1, TimeUnit.SECONDS);
                } catch (Exception e) {
                    // The retrying loser passes through alone
                }
                return PaymentReceipt.approved("auth-" + UUID.randomUUID());
            });

            ExecutorService executor = Executors.newFixedThreadPool(2);
            CountDownLatch startLatch = new CountDownLatch(1);
            Future<CommandResult> first = executor.submit(() -> {
                startLatch.await();
                return handler.handle(ConfirmOrderCommand.of(orderId));
            });
            Future<CommandResult> second = executor.submit(() -> {
                startLatch.await();
                return handler.handle(ConfirmOrderCommand.of(orderId));
            });
            startLatch.countDown();

            CommandResult a = first.get(10, TimeUnit.SECONDS);
            CommandResult b = second.get(10, TimeUnit.SECONDS);
            executor.shutdown();

            System.out.println("A: appended=" + a.getAppendedEvents().size() + ", version=" + a.getResultingVersion());
            System.out.println("B: appended=" + b.getAppendedEvents().size() + ", version=" + b.getResultingVersion());

            assertEquals(1, (a.isNoOp() ? 0 : 1) + (b.isNoOp() ? 0 : 1));
            assertEquals(2, a.getResultingVersion());
            assertEquals(2, b.getResultingVersion());
            assertEquals(2, store.loadStream(orderId).size());
            assertTrue(meterRegistry.counter("orders.concurrency.retries", "command", "CONFIRM_ORDER").count() >= 1);

            printSuccess("One confirm won, the other retried into a no-op");
        }

        @Test
        @DisplayName("A retried confirm reuses the same payment attempt token")
        void testRetriedConfirm_ReusesAttemptToken() {
            printTestHeader("Retried Confirm - Same Token");

            InMemoryEventStore realStore = new InMemoryEventStore(event -> { });
            EventStore flakyStore = spy(realStore);
            OrderCommandHandler flakyHandler = handlerFor(flakyStore);
            UUID orderId = flakyHandler.handle(CreateOrderCommand.of(customerId, CurrencyCode.JPY,
                    List.of(line("P1", 1, "10.00")))).getAggregateId();

            doThrow(new ConcurrencyConflictException(orderId, 1, 2))
                    .doCallRealMethod()
                    .when(flakyStore).append(eq(orderId), anyLong(), anyList(), any());

            ConfirmOrderCommand command = ConfirmOrderCommand.of(orderId);
            CommandResult result = flakyHandler.handle(command);

            ArgumentCaptor<PaymentAuthorization> captor = ArgumentCaptor.forClass(PaymentAuthorization.class);
            verify(paymentGateway, times(2)).authorize(captor.capture());
            assertEquals(command.getCommandId().toString(), captor.getAllValues().get(0).getAttemptToken());
            assertEquals(command.getCommandId().toString(), captor.getAllValues().get(1).getAttemptToken());
            assertEquals(2, result.getResultingVersion());

            printSuccess("Both attempts used token " + command.getCommandId());
        }

        @Test
        @DisplayName("Retry exhaustion surfaces the conflict")
        void testRetryExhaustion_SurfacesConflict() {
            printTestHeader("Retry Exhaustion");

            UUID orderId = UUID.randomUUID();
            OrderEvent created = OrderEvent.of(orderId, 1,
                    new OrderCreated(customerId, CurrencyCode.JPY, List.of(line("P1", 1, "1.00"))), NOW);
            EventStore alwaysConflicting = mock(EventStore.class);
            when(alwaysConflicting.loadStream(orderId)).thenReturn(List.of(created));
            when(alwaysConflicting.append(eq(orderId), anyLong(), anyList(), any()))
                    .thenThrow(new ConcurrencyConflictException(orderId, 1, 2));

            assertThrows(ConcurrencyConflictException.class,
                    () -> handlerFor(alwaysConflicting).handle(AddItemCommand.of(orderId, line("P2", 1, "1.00"))));

            verify(alwaysConflicting, times(5)).append(eq(orderId), anyLong(), anyList(), any());
            assertEquals(1.0, meterRegistry.counter("orders.concurrency.exhausted").count());

            printSuccess("Conflict surfaced after 5 attempts");
        }

        @Test
        @DisplayName("A corrupt stream surfaces immediately, without retry")
        void testCorruptStream_NoRetry() {
            printTestHeader("Corrupt Stream - No Retry");

            UUID orderId = UUID.randomUUID();
            EventStore corrupt = mock(EventStore.class);
            when(corrupt.loadStream(orderId)).thenReturn(List.of(
                    OrderEvent.of(orderId, 1,
                            new OrderCreated(customerId, CurrencyCode.JPY, List.of(line("P1", 1, "1.00"))), NOW),
                    OrderEvent.of(orderId, 2, new UnrecognizedEvent("GiftWrapped", "{}"), NOW)));

            assertThrows(CorruptStreamException.class,
                    () -> handlerFor(corrupt).handle(AddItemCommand.of(orderId, line("P2", 1, "1.00"))));

            verify(corrupt, times(1)).loadStream(orderId);
            verify(corrupt, never()).append(any(), anyLong(), anyList(), any());

            printSuccess("Corruption surfaced on first load");
        }
    }

    @Nested
    @DisplayName("Notifications")
    class Notifications {

        @Test
        @DisplayName("Create and confirm notify once with a token derived from the stream position")
        void testNotificationTokens() {
            printTestHeader("Notification Tokens");

            UUID orderId = createOrder();
            handler.handle(AddItemCommand.of(orderId, line("P2", 1, "1.00")));
            handler.handle(ConfirmOrderCommand.of(orderId));
            handler.handle(ConfirmOrderCommand.of(orderId));

            ArgumentCaptor<OrderNotification> created = ArgumentCaptor.forClass(OrderNotification.class);
            ArgumentCaptor<OrderNotification> confirmed = ArgumentCaptor.forClass(OrderNotification.class);
            verify(notificationPort, times(1)).orderCreated(created.capture());
            verify(notificationPort, times(1)).orderConfirmed(confirmed.capture());

            assertEquals(orderId + ":1", created.getValue().getNotificationToken());
            assertEquals(orderId + ":3", confirmed.getValue().getNotificationToken());
            assertEquals(0, new BigDecimal("21.00").compareTo(confirmed.getValue().getTotalAmount()));

            printSuccess("Tokens " + created.getValue().getNotificationToken()
                    + " and " + confirmed.getValue().getNotificationToken());
        }

        @Test
        @DisplayName("A failing notification does not fail the command")
        void testNotificationFailure_CommandSucceeds() {
            printTestHeader("Notification Failure");

            doThrow(new IllegalStateException("mail server down"))
                    .when(notificationPort).orderCreated(any());

            CommandResult result = handler.handle(
                    CreateOrderCommand.of(customerId, CurrencyCode.JPY, List.of(line("P1", 1, "1.00"))));

            assertEquals(1, result.getResultingVersion());
            assertEquals(1, store.loadStream(result.getAggregateId()).size());

            printSuccess("Command succeeded despite notification failure");
        }
    }
}
