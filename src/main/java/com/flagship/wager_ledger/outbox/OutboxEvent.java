package com.flagship.wager_ledger.outbox;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A wager event waiting in the outbox table, or already handed to Kafka.
 */
@Value
@Builder(toBuilder = true)
public class OutboxEvent {
    UUID id;
    UUID wagerId;
    String eventType;
    String payload;
    String correlationId;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent pending(UUID wagerId, String eventType, String payload,
                                      String correlationId, Instant now) {
        return OutboxEvent.builder()
            .id(UUID.randomUUID())
            .wagerId(wagerId)
            .eventType(eventType)
            .payload(payload)
            .correlationId(correlationId)
            .createdAt(now)
            .retryCount(0)
            .build();
    }
}
