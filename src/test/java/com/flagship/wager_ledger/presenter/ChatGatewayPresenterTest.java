package com.flagship.wager_ledger.presenter;

import com.flagship.wager_ledger.support.WagerFixtures;
import com.flagship.wager_ledger.wager.Wager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.web.client.MockServerRestTemplateCustomizer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * Chat gateway calls against a mocked HTTP server.
 */
class ChatGatewayPresenterTest {

    private static final String BASE_URL = "http://gateway.test";

    private ChatGatewayPresenter presenter;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        MockServerRestTemplateCustomizer customizer = new MockServerRestTemplateCustomizer();
        presenter = new ChatGatewayPresenter(new RestTemplateBuilder(customizer), BASE_URL);
        server = customizer.getServer();
    }

    @Test
    @DisplayName("A delivered notice is sent to the destination")
    void noticeDelivered() {
        server.expect(requestTo(BASE_URL + "/notices"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.destination").value("chan-picks"))
                .andExpect(jsonPath("$.message").value("Bet Won"))
                .andRespond(withSuccess());

        presenter.publishNotice("chan-picks", "Bet Won");

        server.verify();
    }

    @Test
    @DisplayName("A notice the gateway refuses raises instead of being dropped")
    void noticeRefused() {
        server.expect(requestTo(BASE_URL + "/notices")).andRespond(withServerError());

        NoticeDeliveryException e = assertThrows(NoticeDeliveryException.class,
                () -> presenter.publishNotice("chan-picks", "Bet Won"));

        assertTrue(e.getMessage().contains("chan-picks"), e.getMessage());
        server.verify();
    }

    @Test
    @DisplayName("The posted artifact carries the long American price of a big parlay")
    void artifactPosted() throws Exception {
        Wager wager = Wager.fromDraft(UUID.randomUUID(),
                WagerFixtures.parlay("user-1", "guild-1", "1.0", 10000, 10000, 10000, 10000), Instant.now());
        server.expect(requestTo(BASE_URL + "/artifacts"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.americanPrice").value(10406040000L))
                .andRespond(withSuccess("{\"messageRef\":\"msg-9\"}", MediaType.APPLICATION_JSON));

        assertEquals("msg-9", presenter.postArtifact(wager));
        server.verify();
    }

    @Test
    @DisplayName("A gateway failure while posting the artifact is a post failure")
    void artifactRefused() {
        Wager wager = Wager.fromDraft(UUID.randomUUID(),
                WagerFixtures.straight("user-1", "guild-1", "1.0", -110), Instant.now());
        server.expect(requestTo(BASE_URL + "/artifacts")).andRespond(withServerError());

        assertThrows(PostFailureException.class, () -> presenter.postArtifact(wager));
    }
}
