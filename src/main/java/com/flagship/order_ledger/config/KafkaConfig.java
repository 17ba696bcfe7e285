package com.flagship.order_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for the event relay. Declared only when the relay is on, so a
 * deployment without a broker never contacts one.
 */
@Configuration
@ConditionalOnProperty(name = "orders.relay.kafka.enabled", havingValue = "true")
public class KafkaConfig {

    @Value("${orders.kafka.topic:order-events}")
    private String orderEventsTopic;

    @Value("${orders.kafka.partitions:3}")
    private int partitions;

    /**
     * Events are keyed by order ID, so one order's events stay in one partition.
     */
    @Bean
    public NewTopic orderEventsTopic() {
        return TopicBuilder.name(orderEventsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
