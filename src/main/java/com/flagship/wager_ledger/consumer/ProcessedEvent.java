package com.flagship.wager_ledger.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Marks a wager event as handled by a consumer group so redelivery does not repeat it.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String eventType;
    UUID wagerId;
    String consumerGroup;
    Instant processedAt;
    Result result;
    String detail;

    public enum Result {
        SUCCESS,
        SKIPPED
    }

    public static ProcessedEvent success(UUID eventId, String eventType, UUID wagerId, String consumerGroup) {
        return new ProcessedEvent(eventId, eventType, wagerId, consumerGroup, Instant.now(), Result.SUCCESS, null);
    }

    public static ProcessedEvent skipped(UUID eventId, String eventType, UUID wagerId,
                                         String consumerGroup, String reason) {
        return new ProcessedEvent(eventId, eventType, wagerId, consumerGroup, Instant.now(), Result.SKIPPED, reason);
    }
}
