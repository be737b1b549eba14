package com.flagship.wager_ledger.wager.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for wager lifecycle events written to the outbox.
 */
public interface WagerEvent {

    /**
     * Unique identifier for this event instance, used by consumers for deduplication.
     */
    UUID getEventId();

    UUID getWagerId();

    Instant getOccurredAt();

    String getEventType();
}
