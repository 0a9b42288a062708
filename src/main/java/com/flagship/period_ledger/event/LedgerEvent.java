package com.flagship.period_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Notification emitted to external observers when ledger settings change.
 *
 * Every settings event carries the new value, so an observer that has seen
 * the stream can rebuild the current configuration without querying back.
 */
public interface LedgerEvent {

    /**
     * Unique identifier for this event instance.
     * Used for deduplication in consumers.
     */
    UUID getEventId();

    /**
     * When this event occurred.
     */
    Instant getOccurredAt();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();
}
