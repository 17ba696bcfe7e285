package com.flagship.order_ledger.eventstore;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flagship.order_ledger.order.event.OrderEvent;
import com.flagship.order_ledger.order.event.OrderEventPayload;
import com.flagship.order_ledger.order.event.OrderEventType;
import com.flagship.order_ledger.order.event.UnrecognizedEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.UUID;

/**
 * JSON encoding of event payloads and of relay envelopes.
 *
 * Payloads are stored under their type's wire name. A name this build does not
 * know decodes to {@link UnrecognizedEvent} with the raw JSON kept as-is, so the
 * event can still be relayed and skipped downstream.
 */
@Component
@RequiredArgsConstructor
public class OrderEventCodec {

    private final ObjectMapper objectMapper;

    public String wireName(OrderEventPayload payload) {
        if (payload instanceof UnrecognizedEvent unrecognized) {
            return unrecognized.getTypeName();
        }
        return payload.type().getWireName();
    }

    public String serialize(OrderEventPayload payload) {
        if (payload instanceof UnrecognizedEvent unrecognized) {
            return unrecognized.getRawPayload();
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + payload.type() + " payload", e);
        }
    }

    public OrderEventPayload deserialize(String typeName, String json) {
        OrderEventType type = OrderEventType.fromWireName(typeName);
        if (type == OrderEventType.UNRECOGNIZED) {
            return new UnrecognizedEvent(typeName, json);
        }
        try {
            return objectMapper.readValue(json, type.getPayloadClass());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed " + typeName + " payload: " + e.getOriginalMessage(), e);
        }
    }

    public OrderEvent decode(UUID eventId, UUID aggregateId, long sequenceNumber,
                             String typeName, String json, Instant occurredAt) {
        OrderEventPayload payload = deserialize(typeName, json);
        return new OrderEvent(eventId, aggregateId, sequenceNumber, payload.type(), payload, occurredAt);
    }

    /**
     * Wraps an event with its stream coordinates for publishing outside the process.
     */
    public String toEnvelope(OrderEvent event) {
        try {
            ObjectNode node = objectMapper.createObjectNode();
            node.put("eventId", event.getEventId().toString());
            node.put("aggregateId", event.getAggregateId().toString());
            node.put("sequenceNumber", event.getSequenceNumber());
            node.put("eventType", wireName(event.getPayload()));
            node.put("occurredAt", event.getOccurredAt().toString());
            node.set("payload", objectMapper.readTree(serialize(event.getPayload())));
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode envelope for event " + event.getEventId(), e);
        }
    }

    /**
     * Reverse of {@link #toEnvelope(OrderEvent)}.
     *
     * @throws IllegalArgumentException if the envelope is missing a field or is not JSON
     */
    public OrderEvent fromEnvelope(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            return decode(
                UUID.fromString(required(node, "eventId").asText()),
                UUID.fromString(required(node, "aggregateId").asText()),
                required(node, "sequenceNumber").asLong(),
                required(node, "eventType").asText(),
                objectMapper.writeValueAsString(required(node, "payload")),
                Instant.parse(required(node, "occurredAt").asText())
            );
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Envelope is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static JsonNode required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Envelope field missing: " + field);
        }
        return value;
    }
}
