package com.flagship.wager_ledger.consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Runs a handler at most once per event and consumer group.
 *
 * The processed marker is written in the same transaction as the handler's own database
 * work. A handler that throws leaves no marker, so the redelivered event is tried again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;

    /**
     * @return true if the handler ran, false if the event had already been handled
     */
    @Transactional
    public boolean processEvent(UUID eventId, String eventType, UUID wagerId,
                                String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping", eventId, consumerGroup);
            return false;
        }

        handler.run();
        repository.save(ProcessedEventEntity.fromDomain(
                ProcessedEvent.success(eventId, eventType, wagerId, consumerGroup)));
        log.debug("Processed event {} ({}) for consumer group {}", eventId, eventType, consumerGroup);
        return true;
    }

    /**
     * Records an event this consumer has no use for, so it is not looked at again.
     */
    @Transactional
    public void skipEvent(UUID eventId, String eventType, UUID wagerId, String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }
        repository.save(ProcessedEventEntity.fromDomain(
                ProcessedEvent.skipped(eventId, eventType, wagerId, consumerGroup, reason)));
        log.debug("Skipped event {} for consumer group {}: {}", eventId, consumerGroup, reason);
    }

    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }
}
