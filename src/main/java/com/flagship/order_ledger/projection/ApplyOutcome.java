package com.flagship.order_ledger.projection;

/**
 * What the projection did with one delivered event.
 */
public enum ApplyOutcome {
    /** The row was inserted or updated. */
    APPLIED,
    /** The event was already reflected in the row. */
    DUPLICATE,
    /** Unrecognized event type: only the watermark moved, if a row exists. */
    IGNORED,
    /** The event is quarantined and was stepped over. */
    SKIPPED,
    /** The event failed every attempt and was quarantined just now. */
    QUARANTINED,
    /** The store had nothing to fill the gap before the event. */
    GAP_UNRESOLVED
}
