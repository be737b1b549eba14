package com.flagship.wager_ledger.api;

import com.flagship.wager_ledger.ledger.WagerLedger;
import com.flagship.wager_ledger.settlement.SettlementEngine;
import com.flagship.wager_ledger.settlement.SettlementOutcome;
import com.flagship.wager_ledger.settlement.SignalKind;
import com.flagship.wager_ledger.support.WagerFixtures;
import com.flagship.wager_ledger.wager.Wager;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Signal endpoints and wager queries.
 */
@WebMvcTest(controllers = {SignalController.class, WagerQueryController.class})
class SignalControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SettlementEngine settlementEngine;

    @MockBean
    private WagerLedger ledger;

    @Test
    @DisplayName("An added signal is applied and the outcome returned")
    void signalAdded() throws Exception {
        when(settlementEngine.onOutcomeSignalAdded("msg-1", SignalKind.WON, "user-1"))
                .thenReturn(SettlementOutcome.APPLIED);

        mockMvc.perform(post("/api/signals")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"artifact_ref\":\"msg-1\",\"actor_id\":\"user-1\",\"kind\":\"won\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.kind").value("WON"))
                .andExpect(jsonPath("$.outcome").value("APPLIED"));
    }

    @Test
    @DisplayName("A removed signal is retracted; no-ops are still 200")
    void signalRemoved() throws Exception {
        when(settlementEngine.onOutcomeSignalRemoved("msg-1", SignalKind.LOST, "user-1"))
                .thenReturn(SettlementOutcome.STALE_STATE);

        mockMvc.perform(delete("/api/signals")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"artifact_ref\":\"msg-1\",\"actor_id\":\"user-1\",\"kind\":\"LOST\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("STALE_STATE"));
    }

    @Test
    @DisplayName("Unknown signal kinds are rejected")
    void unknownKind() throws Exception {
        mockMvc.perform(post("/api/signals")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"artifact_ref\":\"msg-1\",\"actor_id\":\"user-1\",\"kind\":\"maybe\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown signal kind: maybe"));

        verify(settlementEngine, never()).onOutcomeSignalAdded(anyString(), any(), anyString());
    }

    @Test
    @DisplayName("A wager is returned with its records and audit trail")
    void getWager() throws Exception {
        UUID id = UUID.randomUUID();
        Instant now = Instant.parse("2024-09-08T20:00:00Z");
        Wager wager = Wager.fromDraft(id, WagerFixtures.straight("user-1", "guild-1", "2.0", -110), now)
                .markPosted("msg-1", now);
        when(ledger.findById(id)).thenReturn(Optional.of(wager));
        when(ledger.findSettlementRecords(id)).thenReturn(List.of());
        when(ledger.findSettlementAudit(id)).thenReturn(List.of());

        mockMvc.perform(get("/api/wagers/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("POSTED"))
                .andExpect(jsonPath("$.american_price").isNumber())
                .andExpect(jsonPath("$.artifact_ref").value("msg-1"))
                .andExpect(jsonPath("$.legs[0].participant").value("Chiefs"));
    }

    @Test
    @DisplayName("Unknown wagers are 404")
    void wagerNotFound() throws Exception {
        UUID id = UUID.randomUUID();
        when(ledger.findById(id)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/wagers/{id}", id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Not Found"));
    }

    @Test
    @DisplayName("Net units are summed over the requested window")
    void netUnits() throws Exception {
        Instant from = Instant.parse("2024-09-01T00:00:00Z");
        Instant to = Instant.parse("2024-10-01T00:00:00Z");
        when(settlementEngine.netUnits("user-1", "guild-1", from, to)).thenReturn(new BigDecimal("0.8182"));

        mockMvc.perform(get("/api/wagers/units")
                        .param("owner_id", "user-1")
                        .param("group_id", "guild-1")
                        .param("from", "2024-09-01T00:00:00Z")
                        .param("to", "2024-10-01T00:00:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.net_units").value(0.8182));
    }

    @Test
    @DisplayName("An inverted window is rejected")
    void invertedWindow() throws Exception {
        mockMvc.perform(get("/api/wagers/units")
                        .param("owner_id", "user-1")
                        .param("group_id", "guild-1")
                        .param("from", "2024-10-01T00:00:00Z")
                        .param("to", "2024-09-01T00:00:00Z"))
                .andExpect(status().isBadRequest());
    }
}
