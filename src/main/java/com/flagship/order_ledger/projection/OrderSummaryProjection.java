package com.flagship.order_ledger.projection;

import com.flagship.order_ledger.eventstore.EventStore;
import com.flagship.order_ledger.observability.ProjectionMetrics;
import com.flagship.order_ledger.order.event.OrderEvent;
import com.flagship.order_ledger.order.event.OrderEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Keeps the order_summaries read model in step with the event store.
 *
 * Deliveries arrive at least once, in any order, from the async dispatcher,
 * the catch-up poller and the Kafka relay listener. Each row carries the
 * sequence number of the last event applied to it, which decides what to do
 * with the next delivery:
 * - seq at or below the watermark: duplicate, ignored
 * - seq exactly one past the watermark: applied
 * - seq further ahead: the missing events are refetched from the store and
 *   applied in order up to and including seq. Nothing is applied speculatively
 *
 * Key design decisions:
 * - Work on one aggregate is serialized by a lock stripe in this instance
 *   and by the row's @Version column across instances
 * - Each event is applied in its own transaction; a failure is retried a
 *   bounded number of times, then the event is quarantined and stepped over
 *   so the rest of the system keeps moving
 * - A rebuild folds the stream from sequence 1 with the same function as
 *   incremental application, so both paths produce the same row
 */
@Service
@Slf4j
public class OrderSummaryProjection {

    private static final int LOCK_STRIPES = 64;

    private final EventStore eventStore;
    private final OrderSummaryRepository summaryRepository;
    private final QuarantinedEventRepository quarantineRepository;
    private final CustomerDirectory customerDirectory;
    private final ProjectionMetrics metrics;
    private final TransactionTemplate transactionTemplate;
    private final int maxAttempts;
    private final ReentrantLock[] locks;

    public OrderSummaryProjection(EventStore eventStore,
                                  OrderSummaryRepository summaryRepository,
                                  QuarantinedEventRepository quarantineRepository,
                                  CustomerDirectory customerDirectory,
                                  ProjectionMetrics metrics,
                                  PlatformTransactionManager transactionManager,
                                  @Value("${orders.projection.max-attempts:3}") int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("orders.projection.max-attempts must be >= 1");
        }
        this.eventStore = eventStore;
        this.summaryRepository = summaryRepository;
        this.quarantineRepository = quarantineRepository;
        this.customerDirectory = customerDirectory;
        this.metrics = metrics;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.maxAttempts = maxAttempts;
        this.locks = new ReentrantLock[LOCK_STRIPES];
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    /**
     * Applies a batch of events for one aggregate, in sequence order.
     */
    public void onEventsAppended(UUID aggregateId, List<OrderEvent> events) {
        List<OrderEvent> ordered = events.stream()
                .sorted(Comparator.comparingLong(OrderEvent::getSequenceNumber))
                .toList();

        ReentrantLock lock = lockFor(aggregateId);
        lock.lock();
        try {
            for (OrderEvent event : ordered) {
                if (!aggregateId.equals(event.getAggregateId())) {
                    throw new IllegalArgumentException(String.format(
                        "Event %s belongs to order %s, not %s",
                        event.getEventId(), event.getAggregateId(), aggregateId));
                }
                applyLocked(event);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies a single delivered event.
     */
    public ApplyOutcome apply(OrderEvent event) {
        ReentrantLock lock = lockFor(event.getAggregateId());
        lock.lock();
        try {
            return applyLocked(event);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the aggregate's row with a fresh fold of its whole stream.
     * Quarantined events are stepped over exactly as incremental application does.
     *
     * @return the rebuilt row, or empty if the stream yields no row
     */
    public Optional<OrderSummary> rebuild(UUID aggregateId) {
        ReentrantLock lock = lockFor(aggregateId);
        lock.lock();
        try {
            Optional<OrderSummary> rebuilt = transactionTemplate.execute(status -> rebuildInTransaction(aggregateId));
            log.info("Rebuilt order summary: orderId={}, watermark={}",
                    aggregateId, rebuilt.map(OrderSummary::getLastAppliedSequence).orElse(0L));
            return rebuilt;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Releases every quarantined event of the aggregate, then rebuilds its row.
     */
    public Optional<OrderSummary> reconcile(UUID aggregateId) {
        ReentrantLock lock = lockFor(aggregateId);
        lock.lock();
        try {
            Optional<OrderSummary> rebuilt = transactionTemplate.execute(status -> {
                int released = quarantineRepository.deleteByAggregateId(aggregateId);
                log.info("Released {} quarantined event(s) of order {}", released, aggregateId);
                return rebuildInTransaction(aggregateId);
            });
            log.info("Reconciled order summary: orderId={}, watermark={}",
                    aggregateId, rebuilt.map(OrderSummary::getLastAppliedSequence).orElse(0L));
            return rebuilt;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies whatever the store holds beyond each row's watermark. Orders whose
     * pending events are all quarantined are left alone until reconciled.
     *
     * @return the number of aggregates that were behind
     */
    public int catchUp() {
        Map<UUID, Long> behind = ProjectionLag.behind(eventStore.streamHeads(),
                summaryRepository.findAllWatermarks(), quarantineRepository.findAllPositions());
        for (Map.Entry<UUID, Long> entry : behind.entrySet()) {
            UUID aggregateId = entry.getKey();
            try {
                onEventsAppended(aggregateId, eventStore.loadStream(aggregateId, entry.getValue()));
            } catch (RuntimeException e) {
                log.warn("Catch-up failed for order {}, will retry next cycle: {}", aggregateId, e.getMessage());
            }
        }
        if (!behind.isEmpty()) {
            log.debug("Catch-up visited {} order(s)", behind.size());
        }
        return behind.size();
    }

    public Optional<OrderSummary> findSummary(UUID aggregateId) {
        return summaryRepository.findById(aggregateId).map(OrderSummaryEntity::toDomain);
    }

    public List<QuarantinedEvent> findQuarantined(UUID aggregateId) {
        return quarantineRepository.findByAggregateIdOrderBySequenceNumberAsc(aggregateId).stream()
                .map(QuarantinedEventEntity::toDomain)
                .toList();
    }

    // ==================== Incremental application ====================

    private ApplyOutcome applyLocked(OrderEvent event) {
        UUID aggregateId = event.getAggregateId();
        long watermark = currentWatermark(aggregateId);
        long sequence = event.getSequenceNumber();

        if (sequence <= watermark) {
            log.debug("Duplicate delivery ignored: orderId={}, sequence={}, watermark={}",
                    aggregateId, sequence, watermark);
            metrics.recordOutcome(ApplyOutcome.DUPLICATE);
            return ApplyOutcome.DUPLICATE;
        }
        if (sequence == watermark + 1) {
            return applyNext(event);
        }

        metrics.recordGap();
        log.info("Gap before event: orderId={}, sequence={}, watermark={}; refetching from store",
                aggregateId, sequence, watermark);

        ApplyOutcome outcome = ApplyOutcome.GAP_UNRESOLVED;
        boolean reached = false;
        for (OrderEvent missing : eventStore.loadStream(aggregateId, watermark)) {
            if (missing.getSequenceNumber() > sequence) {
                break;
            }
            outcome = applyNext(missing);
            reached = missing.getSequenceNumber() == sequence;
        }
        if (!reached) {
            log.warn("Store has no events up to sequence {} of order {}; delivery left unapplied",
                    sequence, aggregateId);
            metrics.recordOutcome(ApplyOutcome.GAP_UNRESOLVED);
            return ApplyOutcome.GAP_UNRESOLVED;
        }
        return outcome;
    }

    private ApplyOutcome applyNext(OrderEvent event) {
        if (quarantineRepository.existsByAggregateIdAndSequenceNumber(
                event.getAggregateId(), event.getSequenceNumber())) {
            transactionTemplate.executeWithoutResult(status -> stepOver(event));
            log.debug("Quarantined event stepped over: orderId={}, sequence={}",
                    event.getAggregateId(), event.getSequenceNumber());
            metrics.recordOutcome(ApplyOutcome.SKIPPED);
            return ApplyOutcome.SKIPPED;
        }

        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                ApplyOutcome outcome = transactionTemplate.execute(status -> writeRow(event));
                metrics.recordOutcome(outcome);
                return outcome;
            } catch (RuntimeException e) {
                lastFailure = e;
                metrics.recordApplyFailure(event.getType().name());
                log.warn("Projection attempt {}/{} failed: orderId={}, sequence={}, type={}, error={}",
                        attempt, maxAttempts, event.getAggregateId(), event.getSequenceNumber(),
                        event.getType(), e.getMessage());
            }
        }

        quarantine(event, lastFailure);
        metrics.recordOutcome(ApplyOutcome.QUARANTINED);
        return ApplyOutcome.QUARANTINED;
    }

    /**
     * Folds one event into the row. Runs inside a transaction.
     */
    private ApplyOutcome writeRow(OrderEvent event) {
        Optional<OrderSummaryEntity> existing = summaryRepository.findById(event.getAggregateId());
        OrderSummary current = existing.map(OrderSummaryEntity::toDomain).orElse(null);

        // Another instance may have applied it since the watermark was read
        if (current != null && event.getSequenceNumber() <= current.getLastAppliedSequence()) {
            return ApplyOutcome.DUPLICATE;
        }

        OrderSummary next = OrderSummaryFold.apply(current, event, customerDirectory::displayName);
        if (next != null) {
            store(existing, next);
        }
        return event.getType() == OrderEventType.UNRECOGNIZED ? ApplyOutcome.IGNORED : ApplyOutcome.APPLIED;
    }

    private void quarantine(OrderEvent event, RuntimeException failure) {
        String error = failure == null ? null : failure.getClass().getSimpleName() + ": " + failure.getMessage();
        transactionTemplate.executeWithoutResult(status -> {
            if (!quarantineRepository.existsByAggregateIdAndSequenceNumber(
                    event.getAggregateId(), event.getSequenceNumber())) {
                quarantineRepository.save(QuarantinedEventEntity.fromDomain(
                        QuarantinedEvent.of(event, maxAttempts, error)));
            }
            stepOver(event);
        });
        log.error("Event quarantined after {} attempts: orderId={}, sequence={}, type={}, error={}",
                maxAttempts, event.getAggregateId(), event.getSequenceNumber(), event.getType(), error);
    }

    /**
     * Moves an existing row's watermark past the event. Runs inside a transaction.
     */
    private void stepOver(OrderEvent event) {
        summaryRepository.findById(event.getAggregateId())
                .filter(row -> row.getLastAppliedSequence() == event.getSequenceNumber() - 1)
                .ifPresent(row -> row.copyFrom(OrderSummaryFold.advance(row.toDomain(), event)));
    }

    // ==================== Rebuild ====================

    private Optional<OrderSummary> rebuildInTransaction(UUID aggregateId) {
        Set<Long> quarantined = quarantineRepository.findByAggregateIdOrderBySequenceNumberAsc(aggregateId).stream()
                .map(QuarantinedEventEntity::getSequenceNumber)
                .collect(Collectors.toSet());

        OrderSummary folded = null;
        for (OrderEvent event : eventStore.loadStream(aggregateId)) {
            if (quarantined.contains(event.getSequenceNumber())) {
                if (folded != null) {
                    folded = OrderSummaryFold.advance(folded, event);
                }
                continue;
            }
            folded = OrderSummaryFold.apply(folded, event, customerDirectory::displayName);
        }

        Optional<OrderSummaryEntity> existing = summaryRepository.findById(aggregateId);
        if (folded == null) {
            existing.ifPresent(summaryRepository::delete);
            return Optional.empty();
        }
        return Optional.of(store(existing, folded).toDomain());
    }

    private OrderSummaryEntity store(Optional<OrderSummaryEntity> existing, OrderSummary summary) {
        if (existing.isPresent()) {
            existing.get().copyFrom(summary);
            return summaryRepository.save(existing.get());
        }
        return summaryRepository.save(OrderSummaryEntity.fromDomain(summary));
    }

    private long currentWatermark(UUID aggregateId) {
        return summaryRepository.findById(aggregateId)
                .map(OrderSummaryEntity::getLastAppliedSequence)
                .orElse(0L);
    }

    private ReentrantLock lockFor(UUID aggregateId) {
        return locks[Math.floorMod(aggregateId.hashCode(), LOCK_STRIPES)];
    }
}
