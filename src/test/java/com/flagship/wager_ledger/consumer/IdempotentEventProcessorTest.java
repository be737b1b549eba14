package com.flagship.wager_ledger.consumer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies that:
 * - A handler runs once per event and consumer group
 * - Consumer groups are independent
 * - A failing handler leaves no marker, so redelivery retries it
 * - Skipped events are recorded and never handled afterwards
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class IdempotentEventProcessorTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("wager_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("ledger.artifact-cache.enabled", () -> "false");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    private static final String CONSUMER_GROUP = "test-consumer";
    private static final String EVENT_TYPE = "WagerSettled";

    @Autowired
    private IdempotentEventProcessor eventProcessor;

    @Autowired
    private ProcessedEventRepository repository;

    @BeforeEach
    void setUp() {
        repository.deleteAll();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("First delivery runs the handler and records the event")
    void testFirstDelivery_RunsHandler() {
        printTestHeader("First Delivery - Runs Handler");

        UUID eventId = UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        boolean processed = eventProcessor.processEvent(eventId, EVENT_TYPE, UUID.randomUUID(),
                CONSUMER_GROUP, calls::incrementAndGet);

        assertTrue(processed);
        assertEquals(1, calls.get());
        ProcessedEventEntity entity = repository.findById(new ProcessedEventEntity.Key(eventId, CONSUMER_GROUP))
                .orElseThrow();
        assertEquals(ProcessedEvent.Result.SUCCESS, entity.getResult());
        assertEquals(EVENT_TYPE, entity.getEventType());

        printSuccess("Handler ran once and the event was recorded");
    }

    @Test
    @DisplayName("Redelivered events do not run the handler again")
    void testRedelivery_SkipsHandler() {
        printTestHeader("Redelivery - Skips Handler");

        UUID eventId = UUID.randomUUID();
        UUID wagerId = UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        boolean first = eventProcessor.processEvent(eventId, EVENT_TYPE, wagerId, CONSUMER_GROUP, calls::incrementAndGet);
        boolean second = eventProcessor.processEvent(eventId, EVENT_TYPE, wagerId, CONSUMER_GROUP, calls::incrementAndGet);
        boolean third = eventProcessor.processEvent(eventId, EVENT_TYPE, wagerId, CONSUMER_GROUP, calls::incrementAndGet);

        System.out.println("Processed: " + first + ", " + second + ", " + third);

        assertTrue(first);
        assertFalse(second);
        assertFalse(third);
        assertEquals(1, calls.get());

        printSuccess("Duplicates skipped");
    }

    @Test
    @DisplayName("Each consumer group handles the same event once")
    void testConsumerGroups_Independent() {
        printTestHeader("Consumer Groups - Independent");

        UUID eventId = UUID.randomUUID();
        UUID wagerId = UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        assertTrue(eventProcessor.processEvent(eventId, EVENT_TYPE, wagerId, "wager-notice-consumer", calls::incrementAndGet));
        assertTrue(eventProcessor.processEvent(eventId, EVENT_TYPE, wagerId, "leaderboard", calls::incrementAndGet));
        assertFalse(eventProcessor.processEvent(eventId, EVENT_TYPE, wagerId, "leaderboard", calls::incrementAndGet));

        assertEquals(2, calls.get());
        assertTrue(eventProcessor.isAlreadyProcessed(eventId, "leaderboard"));
        assertFalse(eventProcessor.isAlreadyProcessed(eventId, "other-group"));

        printSuccess("Consumer groups processed independently");
    }

    @Test
    @DisplayName("A failing handler leaves no marker and can be retried")
    void testFailedHandler_CanRetry() {
        printTestHeader("Failed Handler - Can Retry");

        UUID eventId = UUID.randomUUID();
        UUID wagerId = UUID.randomUUID();

        RuntimeException thrown = assertThrows(RuntimeException.class, () ->
                eventProcessor.processEvent(eventId, EVENT_TYPE, wagerId, CONSUMER_GROUP, () -> {
                    throw new RuntimeException("chat gateway unavailable");
                }));
        assertEquals("chat gateway unavailable", thrown.getMessage());
        assertFalse(eventProcessor.isAlreadyProcessed(eventId, CONSUMER_GROUP));

        AtomicInteger calls = new AtomicInteger();
        assertTrue(eventProcessor.processEvent(eventId, EVENT_TYPE, wagerId, CONSUMER_GROUP, calls::incrementAndGet));
        assertEquals(1, calls.get());

        printSuccess("Failure left no marker and the retry succeeded");
    }

    @Test
    @DisplayName("Skipped events are recorded and never handled")
    void testSkipEvent_PreventsProcessing() {
        printTestHeader("Skip Event - Prevents Processing");

        UUID eventId = UUID.randomUUID();
        UUID wagerId = UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        eventProcessor.skipEvent(eventId, "WagerPosted", wagerId, CONSUMER_GROUP, "No notice for posted wagers");
        eventProcessor.skipEvent(eventId, "WagerPosted", wagerId, CONSUMER_GROUP, "No notice for posted wagers");
        boolean processed = eventProcessor.processEvent(eventId, "WagerPosted", wagerId, CONSUMER_GROUP,
                calls::incrementAndGet);

        assertFalse(processed);
        assertEquals(0, calls.get());
        ProcessedEventEntity entity = repository.findById(new ProcessedEventEntity.Key(eventId, CONSUMER_GROUP))
                .orElseThrow();
        assertEquals(ProcessedEvent.Result.SKIPPED, entity.getResult());
        assertEquals("No notice for posted wagers", entity.getDetail());
        assertEquals(1, repository.count());

        printSuccess("Skip recorded once and blocks processing");
    }
}
