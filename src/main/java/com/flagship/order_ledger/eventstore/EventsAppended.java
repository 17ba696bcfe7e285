package com.flagship.order_ledger.eventstore;

import com.flagship.order_ledger.order.event.OrderEvent;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Application event published by the store after events were durably appended.
 */
@Value
public class EventsAppended {
    UUID aggregateId;
    List<OrderEvent> events;
}
