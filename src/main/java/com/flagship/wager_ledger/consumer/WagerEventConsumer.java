package com.flagship.wager_ledger.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.wager_ledger.observability.CorrelationContext;
import com.flagship.wager_ledger.wager.event.WagerPostedEvent;
import com.flagship.wager_ledger.wager.event.WagerSettledEvent;
import com.flagship.wager_ledger.wager.event.WagerSettlementReversedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Consumes the wagers topic and turns settlement events into result notices.
 *
 * Offsets are acknowledged only after the event has been handled (or recorded as
 * skipped); a failure leaves the record to be redelivered.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class WagerEventConsumer {

    static final String CONSUMER_GROUP = "wager-notice-consumer";

    private final IdempotentEventProcessor eventProcessor;
    private final WagerNoticeHandler noticeHandler;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.wagers:wagers}",
        groupId = "${spring.kafka.consumer.group-id:wager-ledger-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        String correlationId = headerValue(record, CorrelationContext.CORRELATION_ID_HEADER);
        if (correlationId != null) {
            MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId);
        }
        try {
            EventEnvelope envelope = parseEnvelope(record);
            if (envelope == null) {
                log.warn("Could not parse wager event at offset {}, acknowledging to skip", record.offset());
                ack.acknowledge();
                return;
            }
            MDC.put(CorrelationContext.WAGER_ID_MDC_KEY, envelope.wagerId().toString());

            boolean processed = route(envelope, record.value());
            ack.acknowledge();
            if (processed) {
                log.info("Processed event: type={}, eventId={}, wagerId={}",
                        envelope.eventType(), envelope.eventId(), envelope.wagerId());
            }
        } catch (RuntimeException e) {
            log.error("Error processing wager event at offset {}: {}", record.offset(), e.getMessage(), e);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.WAGER_ID_MDC_KEY);
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
        }
    }

    private boolean route(EventEnvelope envelope, String payload) {
        return switch (envelope.eventType()) {
            case WagerSettledEvent.EVENT_TYPE -> eventProcessor.processEvent(
                    envelope.eventId(), envelope.eventType(), envelope.wagerId(), CONSUMER_GROUP,
                    () -> noticeHandler.onWagerSettled(deserialize(payload, WagerSettledEvent.class)));
            case WagerSettlementReversedEvent.EVENT_TYPE -> eventProcessor.processEvent(
                    envelope.eventId(), envelope.eventType(), envelope.wagerId(), CONSUMER_GROUP,
                    () -> noticeHandler.onSettlementReversed(deserialize(payload, WagerSettlementReversedEvent.class)));
            case WagerPostedEvent.EVENT_TYPE -> {
                eventProcessor.skipEvent(envelope.eventId(), envelope.eventType(), envelope.wagerId(),
                        CONSUMER_GROUP, "The posted artifact is its own notice");
                yield false;
            }
            default -> {
                log.debug("Unknown event type {}, skipping", envelope.eventType());
                eventProcessor.skipEvent(envelope.eventId(), envelope.eventType(), envelope.wagerId(),
                        CONSUMER_GROUP, "Unknown event type");
                yield false;
            }
        };
    }

    private EventEnvelope parseEnvelope(ConsumerRecord<String, String> record) {
        try {
            JsonNode node = objectMapper.readTree(record.value());
            String eventType = headerValue(record, "eventType");
            if (eventType == null) {
                eventType = node.path("eventType").asText("Unknown");
            }
            return new EventEnvelope(
                    UUID.fromString(node.get("eventId").asText()),
                    UUID.fromString(node.get("wagerId").asText()),
                    eventType);
        } catch (Exception e) {
            log.error("Failed to parse event envelope: {}", e.getMessage());
            return null;
        }
    }

    private static String headerValue(ConsumerRecord<String, String> record, String name) {
        Header header = record.headers().lastHeader(name);
        return header == null ? null : new String(header.value(), StandardCharsets.UTF_8);
    }

    private <T> T deserialize(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    private record EventEnvelope(UUID eventId, UUID wagerId, String eventType) {
    }
}
