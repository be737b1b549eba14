package com.flagship.wager_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.wager_ledger.observability.CorrelationContext;
import com.flagship.wager_ledger.wager.event.WagerEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Writes wager events to the outbox inside the caller's transaction, and gives the
 * publisher its batches.
 *
 * An event is written if and only if the ledger change that produced it commits.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Must run inside an existing transaction; there is no outbox write without a ledger change.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(WagerEvent event) {
        OutboxEvent pending = OutboxEvent.pending(
                event.getWagerId(),
                event.getEventType(),
                serializePayload(event),
                CorrelationContext.hasCorrelationId() ? CorrelationContext.getCorrelationId() : null,
                Instant.now());

        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(pending));
        log.debug("Saved outbox event: type={}, wagerId={}", event.getEventType(), event.getWagerId());
        return saved.toDomain();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findPublishable(int maxRetries, int limit) {
        return repository.findPublishableForUpdate(maxRetries, limit)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished(Instant.now());
            repository.save(entity);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Marked event {} as failed (retry #{}): {}", eventId, entity.getRetryCount(), errorMessage);
        });
    }

    private String serializePayload(WagerEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize " + event.getEventType() + " payload", e);
        }
    }
}
