package com.flagship.order_ledger.eventstore;

import com.flagship.order_ledger.order.event.OrderEvent;
import com.flagship.order_ledger.order.event.OrderEventPayload;
import com.flagship.order_ledger.order.exception.ConcurrencyConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Event store backed by the order_events table.
 *
 * Key design decisions:
 * - The version check and the inserts run in one transaction, so an
 *   append either lands completely or not at all
 * - The version check catches stale writers early; the unique
 *   (aggregate_id, sequence_number) constraint catches writers that raced
 *   past the check at the same time. Both surface as ConcurrencyConflictException
 * - No table or global locks: two streams never contend for the same rows
 * - EventsAppended is published inside the transaction and delivered to
 *   listeners after commit, so nobody is notified of a rolled-back append
 */
@Component
@ConditionalOnProperty(name = "orders.event-store.backend", havingValue = "jpa", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class JpaEventStore implements EventStore {

    private final OrderEventRepository repository;
    private final OrderEventCodec codec;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    @Transactional(readOnly = true)
    public List<OrderEvent> loadStream(UUID aggregateId) {
        return repository.findByAggregateIdOrderBySequenceNumberAsc(aggregateId).stream()
                .map(entity -> entity.toDomain(codec))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderEvent> loadStream(UUID aggregateId, long afterSequence) {
        return repository.findByAggregateIdAndSequenceNumberGreaterThanOrderBySequenceNumberAsc(
                    aggregateId, afterSequence).stream()
                .map(entity -> entity.toDomain(codec))
                .toList();
    }

    @Override
    @Transactional
    public List<OrderEvent> append(UUID aggregateId, long expectedVersion,
                                   List<OrderEventPayload> payloads, Instant occurredAt) {
        AppendRequests.validate(aggregateId, expectedVersion, payloads, occurredAt);

        long currentVersion = repository.findCurrentVersion(aggregateId);
        if (currentVersion != expectedVersion) {
            log.debug("Stale append rejected: aggregateId={}, expectedVersion={}, currentVersion={}",
                    aggregateId, expectedVersion, currentVersion);
            throw new ConcurrencyConflictException(aggregateId, expectedVersion, currentVersion);
        }

        List<OrderEvent> events = AppendRequests.sequence(aggregateId, expectedVersion, payloads, occurredAt);
        List<OrderEventEntity> entities = new ArrayList<>(events.size());
        for (OrderEvent event : events) {
            entities.add(OrderEventEntity.fromDomain(event,
                    codec.wireName(event.getPayload()), codec.serialize(event.getPayload())));
        }

        try {
            repository.saveAllAndFlush(entities);
        } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
            log.debug("Concurrent append detected by constraint: aggregateId={}, expectedVersion={}",
                    aggregateId, expectedVersion);
            throw new ConcurrencyConflictException(aggregateId, expectedVersion,
                    ConcurrencyConflictException.UNKNOWN_VERSION, e);
        }

        log.debug("Appended {} event(s) to order {}: sequence {}..{}",
                events.size(), aggregateId, expectedVersion + 1, expectedVersion + events.size());

        eventPublisher.publishEvent(new EventsAppended(aggregateId, events));
        return events;
    }

    @Override
    @Transactional(readOnly = true)
    public Map<UUID, Long> streamHeads() {
        return repository.findStreamHeads().stream()
                .collect(Collectors.toMap(
                    OrderEventRepository.StreamHead::getAggregateId,
                    OrderEventRepository.StreamHead::getVersion));
    }
}
