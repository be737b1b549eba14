package com.flagship.wager_ledger.outbox;

import com.flagship.wager_ledger.observability.CorrelationContext;
import com.flagship.wager_ledger.observability.OutboxMetrics;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Verifies that:
 * - Events are sent keyed by wager id with type and correlation headers
 * - Successful sends mark the event published
 * - Failed sends are recorded against the event, and the last allowed failure dead-letters it
 */
@ExtendWith(MockitoExtension.class)
class OutboxPublisherTest {

    private static final String TOPIC = "wagers";
    private static final int MAX_RETRIES = 3;

    @Mock
    private OutboxService outboxService;

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Mock
    private OutboxMetrics outboxMetrics;

    @Captor
    private ArgumentCaptor<ProducerRecord<String, String>> recordCaptor;

    private OutboxPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics, TOPIC, 10, MAX_RETRIES, 1000);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private static OutboxEvent event(String eventType, int retryCount) {
        return OutboxEvent.pending(UUID.randomUUID(), eventType, "{\"eventType\":\"" + eventType + "\"}",
                        "corr-1", Instant.parse("2024-09-08T20:00:00Z"))
                .toBuilder()
                .retryCount(retryCount)
                .build();
    }

    private static ProducerRecord<String, String> anyRecord() {
        return any();
    }

    private static CompletableFuture<SendResult<String, String>> sent(ProducerRecord<String, String> record) {
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 1), 42L, 0, 0L, 0, 0);
        return CompletableFuture.completedFuture(new SendResult<>(record, metadata));
    }

    @Test
    @DisplayName("Published events are keyed by wager id and marked published")
    void testPublish_MarksPublished() {
        printTestHeader("Publish - Marks Published");

        OutboxEvent event = event("WagerSettled", 0);
        when(outboxService.findPublishable(MAX_RETRIES, 10)).thenReturn(List.of(event));
        when(kafkaTemplate.send(anyRecord()))
                .thenAnswer(inv -> sent(inv.getArgument(0)));

        publisher.publishPendingEvents();

        verify(kafkaTemplate).send(recordCaptor.capture());
        ProducerRecord<String, String> record = recordCaptor.getValue();

        assertEquals(TOPIC, record.topic());
        assertEquals(event.getWagerId().toString(), record.key());
        assertEquals(event.getPayload(), record.value());
        assertEquals("WagerSettled",
                new String(record.headers().lastHeader("eventType").value(), StandardCharsets.UTF_8));
        assertEquals("corr-1", new String(
                record.headers().lastHeader(CorrelationContext.CORRELATION_ID_HEADER).value(), StandardCharsets.UTF_8));

        verify(outboxService).markPublished(event.getId());
        verify(outboxMetrics).recordEventPublished("WagerSettled");
        verify(outboxService, never()).markFailed(any(), anyString());

        printSuccess("Event sent and marked published");
    }

    @Test
    @DisplayName("A failed send is recorded and the event stays unpublished")
    void testPublish_FailureRecorded() {
        printTestHeader("Publish - Failure Recorded");

        OutboxEvent event = event("WagerPosted", 0);
        when(kafkaTemplate.send(anyRecord()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.publishEvent(event);

        verify(outboxService, never()).markPublished(any());
        verify(outboxService).markFailed(eq(event.getId()), anyString());
        verify(outboxMetrics).recordEventPublishFailed("WagerPosted");
        verify(outboxMetrics, never()).recordEventDeadLettered(anyString());

        printSuccess("Failure recorded, event left for retry");
    }

    @Test
    @DisplayName("The last allowed failure dead-letters the event")
    void testPublish_DeadLettered() {
        printTestHeader("Publish - Dead Lettered");

        OutboxEvent event = event("WagerSettlementReversed", MAX_RETRIES - 1);
        when(kafkaTemplate.send(anyRecord()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.publishEvent(event);

        verify(outboxService).markFailed(eq(event.getId()), anyString());
        verify(outboxMetrics).recordEventDeadLettered("WagerSettlementReversed");

        printSuccess("Event dead-lettered at the retry limit");
    }

    @Test
    @DisplayName("One failing event does not stop the rest of the batch")
    void testPublish_BatchContinuesAfterFailure() {
        printTestHeader("Publish - Batch Continues After Failure");

        OutboxEvent failing = event("WagerSettled", 0);
        OutboxEvent ok = event("WagerSettled", 0);
        when(outboxService.findPublishable(MAX_RETRIES, 10)).thenReturn(List.of(failing, ok));
        when(kafkaTemplate.send(anyRecord())).thenAnswer(inv -> {
            ProducerRecord<String, String> record = inv.getArgument(0);
            if (record.key().equals(failing.getWagerId().toString())) {
                return CompletableFuture.failedFuture(new IllegalStateException("broker down"));
            }
            return sent(record);
        });

        publisher.publishPendingEvents();

        verify(kafkaTemplate, times(2)).send(anyRecord());
        verify(outboxService).markFailed(eq(failing.getId()), anyString());
        verify(outboxService).markPublished(ok.getId());

        printSuccess("Remaining events published after a failure");
    }
}
