package com.flagship.order_ledger.relay;

import com.flagship.order_ledger.eventstore.OrderEventCodec;
import com.flagship.order_ledger.order.event.OrderEvent;
import com.flagship.order_ledger.projection.OrderSummaryProjection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Feeds relayed order events into the projection.
 *
 * Manual acknowledgment: the offset is committed only after the projection
 * took the event. The projection's watermark makes redelivery harmless, so
 * no processed-event table is needed here.
 */
@Component
@ConditionalOnProperty(name = "orders.relay.kafka.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class OrderEventKafkaListener {

    private final OrderEventCodec codec;
    private final OrderSummaryProjection projection;

    @KafkaListener(
        topics = "${orders.kafka.topic:order-events}",
        groupId = "${spring.kafka.consumer.group-id:order-summary-projection}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        OrderEvent event;
        try {
            event = codec.fromEnvelope(record.value());
        } catch (IllegalArgumentException e) {
            log.warn("Could not parse relayed event at offset {}, acknowledging to skip: {}",
                    record.offset(), e.getMessage());
            ack.acknowledge();
            return;
        }

        try {
            projection.onEventsAppended(event.getAggregateId(), List.of(event));
            ack.acknowledge();
        } catch (RuntimeException e) {
            log.error("Error projecting relayed event at offset {}: {}", record.offset(), e.getMessage(), e);
            throw e;
        }
    }
}
