package com.flagship.order_ledger.order.event;

import lombok.Value;

/**
 * Placeholder for a stored event whose type name this build does not know,
 * e.g. one written by a newer version of the service.
 *
 * Keeps the raw JSON so nothing is lost when the event is relayed onward.
 */
@Value
public class UnrecognizedEvent implements OrderEventPayload {
    String typeName;
    String rawPayload;

    public static final String EVENT_TYPE = "Unrecognized";

    @Override
    public OrderEventType type() {
        return OrderEventType.UNRECOGNIZED;
    }
}
