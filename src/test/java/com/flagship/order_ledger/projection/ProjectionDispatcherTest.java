package com.flagship.order_ledger.projection;

import com.flagship.order_ledger.eventstore.EventsAppended;
import com.flagship.order_ledger.order.event.OrderCancelled;
import com.flagship.order_ledger.order.event.OrderEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class ProjectionDispatcherTest {

    @Test
    @DisplayName("Appended events are handed to the projection")
    void testDispatch() {
        OrderSummaryProjection projection = mock(OrderSummaryProjection.class);
        UUID orderId = UUID.randomUUID();
        List<OrderEvent> events = List.of(OrderEvent.of(orderId, 1, new OrderCancelled(null), Instant.now()));

        new ProjectionDispatcher(projection).onEventsAppended(new EventsAppended(orderId, events));

        verify(projection).onEventsAppended(orderId, events);
    }

    @Test
    @DisplayName("A projection failure is logged and left to catch-up, never thrown at the appender")
    void testDispatch_FailureSwallowed() {
        OrderSummaryProjection projection = mock(OrderSummaryProjection.class);
        UUID orderId = UUID.randomUUID();
        doThrow(new IllegalStateException("database unavailable"))
                .when(projection).onEventsAppended(eq(orderId), anyList());

        assertDoesNotThrow(() -> new ProjectionDispatcher(projection).onEventsAppended(
                new EventsAppended(orderId, List.of())));
    }
}
