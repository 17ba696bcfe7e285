package com.flagship.order_ledger.eventstore;

import com.flagship.order_ledger.order.event.OrderEvent;
import com.flagship.order_ledger.order.event.OrderEventPayload;
import com.flagship.order_ledger.order.exception.ConcurrencyConflictException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only log of order events, one stream per aggregate.
 *
 * The store is the only authority on write order. Appends to the same stream
 * are mutually exclusive; appends to different streams never wait on each other.
 * After a successful append the store publishes {@link EventsAppended}.
 */
public interface EventStore {

    /**
     * Loads a whole stream in sequence order.
     *
     * @return the events, or an empty list if the aggregate has never been written
     */
    List<OrderEvent> loadStream(UUID aggregateId);

    /**
     * Loads the part of a stream after the given sequence number.
     */
    List<OrderEvent> loadStream(UUID aggregateId, long afterSequence);

    /**
     * Appends events as sequence numbers expectedVersion+1, expectedVersion+2, ...
     *
     * All or nothing: either every payload is appended or none is.
     *
     * @param expectedVersion the stream length the caller based its decision on
     * @return the appended events
     * @throws ConcurrencyConflictException if the stream length differs from expectedVersion
     */
    List<OrderEvent> append(UUID aggregateId, long expectedVersion,
                            List<OrderEventPayload> payloads, Instant occurredAt);

    /**
     * Current version of every stream, keyed by aggregate ID.
     */
    Map<UUID, Long> streamHeads();
}
