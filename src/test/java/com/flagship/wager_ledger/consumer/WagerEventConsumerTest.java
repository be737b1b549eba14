package com.flagship.wager_ledger.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.wager_ledger.config.JacksonConfig;
import com.flagship.wager_ledger.observability.CorrelationContext;
import com.flagship.wager_ledger.presenter.NoticeDeliveryException;
import com.flagship.wager_ledger.support.RecordingPresenter;
import com.flagship.wager_ledger.support.WagerFixtures;
import com.flagship.wager_ledger.wager.Wager;
import com.flagship.wager_ledger.wager.WagerStatus;
import com.flagship.wager_ledger.wager.event.WagerPostedEvent;
import com.flagship.wager_ledger.wager.event.WagerSettledEvent;
import com.flagship.wager_ledger.wager.event.WagerSettlementReversedEvent;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.support.Acknowledgment;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Routing of wager events to result notices, with the idempotency store mocked.
 */
class WagerEventConsumerTest {

    private static final Instant NOW = Instant.parse("2024-10-06T23:30:00Z");

    private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();

    private IdempotentEventProcessor eventProcessor;
    private RecordingPresenter presenter;
    private Acknowledgment ack;
    private WagerEventConsumer consumer;
    private Wager wager;

    @BeforeEach
    void setUp() {
        eventProcessor = mock(IdempotentEventProcessor.class);
        presenter = new RecordingPresenter();
        ack = mock(Acknowledgment.class);
        consumer = new WagerEventConsumer(eventProcessor, new WagerNoticeHandler(presenter), objectMapper);
        wager = Wager.fromDraft(UUID.randomUUID(), WagerFixtures.straight("user-1", "guild-1", "2.0", -110), NOW)
                .markPosted("msg-7", NOW);

        when(eventProcessor.processEvent(any(), anyString(), any(), anyString(), any())).thenAnswer(invocation -> {
            Runnable handler = invocation.getArgument(4);
            handler.run();
            return true;
        });
    }

    private ConsumerRecord<String, String> record(Object event, String eventType) throws Exception {
        ConsumerRecord<String, String> record = new ConsumerRecord<>("wagers", 0, 42L,
                wager.getId().toString(), objectMapper.writeValueAsString(event));
        if (eventType != null) {
            record.headers().add("eventType", eventType.getBytes(StandardCharsets.UTF_8));
        }
        record.headers().add(CorrelationContext.CORRELATION_ID_HEADER, "corr-123".getBytes(StandardCharsets.UTF_8));
        return record;
    }

    @Test
    @DisplayName("A settled event posts a result notice to the wager's destination")
    void settledPostsNotice() throws Exception {
        WagerSettledEvent event = WagerSettledEvent.fromWager(wager, WagerStatus.SETTLED_WON,
                new BigDecimal("1.8182"), NOW);

        consumer.consume(record(event, WagerSettledEvent.EVENT_TYPE), ack);

        assertEquals(1, presenter.getNotices().size());
        assertEquals("chan-picks: Bet Won: <@user-1> +1.82 units", presenter.getNotices().get(0));
        verify(eventProcessor).processEvent(eq(event.getEventId()), eq(WagerSettledEvent.EVENT_TYPE),
                eq(wager.getId()), eq(WagerEventConsumer.CONSUMER_GROUP), any());
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("The event type falls back to the payload when the header is missing")
    void eventTypeFromPayload() throws Exception {
        WagerSettledEvent event = WagerSettledEvent.fromWager(wager, WagerStatus.VOIDED, null, NOW);

        consumer.consume(record(event, null), ack);

        assertEquals("chan-picks: Bet Cancelled: <@user-1> no units moved", presenter.getNotices().get(0));
    }

    @Test
    @DisplayName("A reversal posts a retraction notice")
    void reversalPostsNotice() throws Exception {
        WagerSettlementReversedEvent event = WagerSettlementReversedEvent.fromWager(wager, WagerStatus.SETTLED_LOST, NOW);

        consumer.consume(record(event, WagerSettlementReversedEvent.EVENT_TYPE), ack);

        assertTrue(presenter.getNotices().get(0).contains("was lost"), presenter.getNotices().get(0));
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Posted events are recorded as skipped without a notice")
    void postedIsSkipped() throws Exception {
        WagerPostedEvent event = WagerPostedEvent.fromWager(wager, NOW);

        consumer.consume(record(event, WagerPostedEvent.EVENT_TYPE), ack);

        assertTrue(presenter.getNotices().isEmpty());
        verify(eventProcessor).skipEvent(eq(event.getEventId()), eq(WagerPostedEvent.EVENT_TYPE),
                eq(wager.getId()), eq(WagerEventConsumer.CONSUMER_GROUP), anyString());
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("An already processed event sends no second notice")
    void duplicateIsIgnored() throws Exception {
        doReturn(false).when(eventProcessor).processEvent(any(), anyString(), any(), anyString(), any());
        WagerSettledEvent event = WagerSettledEvent.fromWager(wager, WagerStatus.SETTLED_LOST,
                new BigDecimal("-2.0000"), NOW);

        consumer.consume(record(event, WagerSettledEvent.EVENT_TYPE), ack);

        assertTrue(presenter.getNotices().isEmpty());
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Unparseable records are acknowledged and skipped")
    void unparseable() {
        ConsumerRecord<String, String> record = new ConsumerRecord<>("wagers", 0, 43L, "key", "not json");

        consumer.consume(record, ack);

        verify(ack).acknowledge();
        verify(eventProcessor, never()).processEvent(any(), anyString(), any(), anyString(), any());
    }

    @Test
    @DisplayName("A notice the chat gateway refuses is not acknowledged and goes out on redelivery")
    void noticeFailureRedelivered() throws Exception {
        Set<UUID> handled = new HashSet<>();
        doAnswer(invocation -> {
            UUID eventId = invocation.getArgument(0);
            if (handled.contains(eventId)) {
                return false;
            }
            Runnable handler = invocation.getArgument(4);
            handler.run();
            handled.add(eventId);
            return true;
        }).when(eventProcessor).processEvent(any(), anyString(), any(), anyString(), any());
        presenter.failNextNotices(1);
        WagerSettledEvent event = WagerSettledEvent.fromWager(wager, WagerStatus.SETTLED_WON,
                new BigDecimal("1.8182"), NOW);
        ConsumerRecord<String, String> record = record(event, WagerSettledEvent.EVENT_TYPE);

        assertThrows(NoticeDeliveryException.class, () -> consumer.consume(record, ack));

        verify(ack, never()).acknowledge();
        assertTrue(handled.isEmpty());
        assertTrue(presenter.getNotices().isEmpty());

        consumer.consume(record, ack);

        verify(ack).acknowledge();
        assertEquals(List.of("chan-picks: Bet Won: <@user-1> +1.82 units"), presenter.getNotices());
    }

    @Test
    @DisplayName("A failing handler is not acknowledged so the record is redelivered")
    void handlerFailureNotAcknowledged() throws Exception {
        doAnswer(invocation -> {
            throw new IllegalStateException("chat gateway down");
        }).when(eventProcessor).processEvent(any(), anyString(), any(), anyString(), any());
        WagerSettledEvent event = WagerSettledEvent.fromWager(wager, WagerStatus.SETTLED_WON,
                new BigDecimal("1.8182"), NOW);

        assertThrows(IllegalStateException.class,
                () -> consumer.consume(record(event, WagerSettledEvent.EVENT_TYPE), ack));

        verify(ack, never()).acknowledge();
    }
}
