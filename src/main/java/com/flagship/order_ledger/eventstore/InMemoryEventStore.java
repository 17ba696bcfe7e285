package com.flagship.order_ledger.eventstore;

import com.flagship.order_ledger.order.event.OrderEvent;
import com.flagship.order_ledger.order.event.OrderEventPayload;
import com.flagship.order_ledger.order.exception.ConcurrencyConflictException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Event store held in process memory, for local runs and tests.
 *
 * Each stream has its own lock. The lock covers the length check and the
 * append together, which is what makes the check-then-append atomic.
 * Nothing survives a restart.
 */
@Component
@ConditionalOnProperty(name = "orders.event-store.backend", havingValue = "memory")
@Slf4j
public class InMemoryEventStore implements EventStore {

    private final ConcurrentHashMap<UUID, Stream> streams = new ConcurrentHashMap<>();
    private final ApplicationEventPublisher eventPublisher;

    public InMemoryEventStore(ApplicationEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    @Override
    public List<OrderEvent> loadStream(UUID aggregateId) {
        return loadStream(aggregateId, 0L);
    }

    @Override
    public List<OrderEvent> loadStream(UUID aggregateId, long afterSequence) {
        Stream stream = streams.get(aggregateId);
        if (stream == null) {
            return List.of();
        }
        stream.lock.lock();
        try {
            int from = (int) Math.min(Math.max(afterSequence, 0L), stream.events.size());
            return List.copyOf(stream.events.subList(from, stream.events.size()));
        } finally {
            stream.lock.unlock();
        }
    }

    @Override
    public List<OrderEvent> append(UUID aggregateId, long expectedVersion,
                                   List<OrderEventPayload> payloads, Instant occurredAt) {
        AppendRequests.validate(aggregateId, expectedVersion, payloads, occurredAt);

        Stream stream = streams.computeIfAbsent(aggregateId, id -> new Stream());
        List<OrderEvent> events;
        stream.lock.lock();
        try {
            long currentVersion = stream.events.size();
            if (currentVersion != expectedVersion) {
                throw new ConcurrencyConflictException(aggregateId, expectedVersion, currentVersion);
            }
            events = AppendRequests.sequence(aggregateId, expectedVersion, payloads, occurredAt);
            stream.events.addAll(events);
        } finally {
            stream.lock.unlock();
        }

        log.debug("Appended {} event(s) to order {} in memory", events.size(), aggregateId);
        eventPublisher.publishEvent(new EventsAppended(aggregateId, events));
        return events;
    }

    @Override
    public Map<UUID, Long> streamHeads() {
        Map<UUID, Long> heads = new HashMap<>();
        streams.forEach((id, stream) -> {
            stream.lock.lock();
            try {
                if (!stream.events.isEmpty()) {
                    heads.put(id, (long) stream.events.size());
                }
            } finally {
                stream.lock.unlock();
            }
        });
        return heads;
    }

    private static final class Stream {
        private final ReentrantLock lock = new ReentrantLock();
        private final List<OrderEvent> events = new ArrayList<>();
    }
}
