package com.flagship.asset_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for ledger events.
 *
 * Events are facts about committed changes. They are published after the
 * transaction that produced them commits, never before.
 */
public interface LedgerEvent {

    /**
     * Unique identifier for this event instance.
     * Used for deduplication in consumers.
     */
    UUID getEventId();

    /**
     * The asset or order this event is about. Used as the Kafka key.
     */
    UUID getAggregateId();

    /**
     * When this event occurred.
     */
    Instant getOccurredAt();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();
}
