package com.flagship.order_ledger.relay;

import com.flagship.order_ledger.eventstore.OrderEventCodec;
import com.flagship.order_ledger.eventstore.OrderEventEntity;
import com.flagship.order_ledger.eventstore.OrderEventRepository;
import com.flagship.order_ledger.observability.ProjectionMetrics;
import com.flagship.order_ledger.order.event.OrderEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Background relay that copies order_events rows to Kafka.
 *
 * The event table doubles as the outbox: a row is unrelayed while its
 * published_at is null.
 *
 * Key design decisions:
 * - Uses SELECT FOR UPDATE SKIP LOCKED so several relays can run side by side
 * - Publishes synchronously, keyed by aggregate ID for partition affinity
 * - A failed send increments relay_attempts; rows that reach max-attempts
 *   are dead letters and need manual intervention
 * - Delivery is at least once. Consumers rely on the projection's watermark
 *   to drop duplicates
 */
@Component
@ConditionalOnProperty(name = "orders.relay.kafka.enabled", havingValue = "true")
@Slf4j
public class EventRelayPublisher {

    private final OrderEventRepository repository;
    private final OrderEventCodec codec;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ProjectionMetrics metrics;
    private final TransactionTemplate transactionTemplate;
    private final String topic;
    private final int batchSize;
    private final int maxAttempts;
    private final long sendTimeoutMs;

    public EventRelayPublisher(OrderEventRepository repository,
                               OrderEventCodec codec,
                               KafkaTemplate<String, String> kafkaTemplate,
                               ProjectionMetrics metrics,
                               PlatformTransactionManager transactionManager,
                               @Value("${orders.kafka.topic:order-events}") String topic,
                               @Value("${orders.relay.batch-size:100}") int batchSize,
                               @Value("${orders.relay.max-attempts:5}") int maxAttempts,
                               @Value("${orders.relay.send-timeout-ms:10000}") long sendTimeoutMs) {
        this.repository = repository;
        this.codec = codec;
        this.kafkaTemplate = kafkaTemplate;
        this.metrics = metrics;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.topic = topic;
        this.batchSize = batchSize;
        this.maxAttempts = maxAttempts;
        this.sendTimeoutMs = sendTimeoutMs;
    }

    @Scheduled(fixedRateString = "${orders.relay.poll-interval-ms:1000}")
    public void relayPendingEvents() {
        try {
            int relayed = relayBatch();
            if (relayed > 0) {
                log.debug("Relayed {} event(s) to {}", relayed, topic);
            }
        } catch (Exception e) {
            log.error("Error in event relay polling loop", e);
        }
    }

    /**
     * Relays one batch in a single transaction that holds the row locks.
     *
     * @return the number of events published
     */
    public int relayBatch() {
        Integer published = transactionTemplate.execute(status -> {
            List<OrderEventEntity> rows = repository.findUnrelayedForUpdate(maxAttempts, batchSize);
            int count = 0;
            for (OrderEventEntity row : rows) {
                if (relay(row)) {
                    count++;
                }
            }
            repository.saveAll(rows);
            return count;
        });
        return published == null ? 0 : published;
    }

    private boolean relay(OrderEventEntity row) {
        OrderEvent event = row.toDomain(codec);
        String eventType = row.getEventType();
        try {
            SendResult<String, String> result = kafkaTemplate
                    .send(topic, event.getAggregateId().toString(), codec.toEnvelope(event))
                    .get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            log.debug("Relayed event: eventId={}, orderId={}, sequence={}, partition={}, offset={}",
                    event.getEventId(), event.getAggregateId(), event.getSequenceNumber(),
                    result.getRecordMetadata().partition(), result.getRecordMetadata().offset());

            row.markPublished();
            metrics.recordRelayed(eventType);
            return true;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            row.markRelayFailed("Interrupted while publishing");
            metrics.recordRelayFailed(eventType);
            return false;
        } catch (Exception e) {
            row.markRelayFailed(e.getMessage());
            metrics.recordRelayFailed(eventType);
            if (row.getRelayAttempts() >= maxAttempts) {
                log.warn("Event {} reached max relay attempts ({}), left as dead letter: orderId={}, sequence={}",
                        row.getEventId(), maxAttempts, row.getAggregateId(), row.getSequenceNumber());
            } else {
                log.error("Failed to relay event: eventId={}, type={}, error={}",
                        row.getEventId(), eventType, e.getMessage());
            }
            return false;
        }
    }
}
