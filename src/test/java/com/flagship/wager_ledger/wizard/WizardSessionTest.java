package com.flagship.wager_ledger.wizard;

import com.flagship.wager_ledger.odds.InvalidOddsException;
import com.flagship.wager_ledger.wager.LineType;
import com.flagship.wager_ledger.wager.WagerType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class WizardSessionTest {

    private static final Instant NOW = Instant.parse("2024-11-03T12:00:00Z");

    private WizardSession session;

    @BeforeEach
    void setUp() {
        session = new WizardSession(UUID.randomUUID(), "user-1", "guild-1", WagerType.STRAIGHT,
                Duration.ofMinutes(10), NOW);
        session.present(StepPrompt.builder()
                .step(WizardStep.SELECT_LINE_TYPE)
                .title("Select line type")
                .option(new StepPrompt.Option("game_line", "Game Line"))
                .option(new StepPrompt.Option("player_prop", "Player Prop"))
                .build());
    }

    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @CsvSource({
        "-110, -110",
        "+150, 150",
        "150, 150",
        "-100, -100",
        "10000, 10000",
        "-10000, -10000"
    })
    @DisplayName("Odds accept an optional plus sign")
    void parsesOdds(String raw, int expected) {
        assertEquals(expected, WizardSession.parseOdds(raw, 10000));
    }

    @ParameterizedTest
    @ValueSource(strings = {"99", "-99", "0", "+0", "10001", "-10001", "1.5", "even"})
    @DisplayName("Odds outside the accepted range or format are rejected")
    void rejectsOdds(String raw) {
        assertThrows(InvalidOddsException.class, () -> WizardSession.parseOdds(raw, 10000));
    }

    @Test
    @DisplayName("Missing odds are rejected")
    void rejectsMissingOdds() {
        assertThrows(InvalidOddsException.class, () -> WizardSession.parseOdds(null, 10000));
    }

    @Test
    @DisplayName("A valid selection moves to the next step")
    void acceptsOfferedSelection() {
        session.accept(WizardInput.select("player_prop"), 10000);

        assertEquals(WizardStep.SELECT_LEAGUE, session.getStep());
        assertEquals(LineType.PLAYER_PROP, session.getDraft().getLineType());
    }

    @Test
    @DisplayName("Rejected input leaves the session untouched")
    void rejectionLeavesStateUnchanged() {
        assertThrows(UnexpectedInputException.class, () -> session.accept(WizardInput.select("parlay"), 10000));
        assertThrows(UnexpectedInputException.class,
                () -> session.accept(WizardInput.form(Map.of("odds", "-110")), 10000));

        assertEquals(WizardStep.SELECT_LINE_TYPE, session.getStep());
        assertNull(session.getDraft().getLineType());
    }

    @Test
    @DisplayName("Rolling back to a checkpoint restores the step, the prompt and the draft choices")
    void rollbackRestoresCheckpoint() {
        StepPrompt lineTypePrompt = session.getCurrentPrompt();
        WizardSession.Checkpoint checkpoint = session.checkpoint();

        session.accept(WizardInput.select("game_line"), 10000);
        session.present(StepPrompt.builder().step(WizardStep.SELECT_LEAGUE).title("Select league").build());
        assertEquals(WizardStep.SELECT_LEAGUE, session.getStep());

        session.rollback(checkpoint);

        assertEquals(WizardStep.SELECT_LINE_TYPE, session.getStep());
        assertSame(lineTypePrompt, session.getCurrentPrompt());
        assertNull(session.getDraft().getLineType());
        session.accept(WizardInput.select("player_prop"), 10000);
        assertEquals(LineType.PLAYER_PROP, session.getDraft().getLineType());
    }

    @Test
    @DisplayName("Cancel is not a step input")
    void cancelIsNotAccepted() {
        UnexpectedInputException e = assertThrows(UnexpectedInputException.class,
                () -> session.accept(WizardInput.cancel(), 10000));
        assertEquals(WizardStep.SELECT_LINE_TYPE, e.getStep());
    }

    @Test
    @DisplayName("Idle timeout is measured from the last activity")
    void expiry() {
        assertFalse(session.isExpired(NOW.plus(Duration.ofMinutes(9))));
        assertTrue(session.isExpired(NOW.plus(Duration.ofMinutes(10))));

        session.touch(NOW.plus(Duration.ofMinutes(9)));
        assertFalse(session.isExpired(NOW.plus(Duration.ofMinutes(18))));
    }

    @Test
    @DisplayName("Only one transition can hold the session at a time")
    void singleFlight() {
        assertTrue(session.tryBegin());
        assertFalse(session.tryBegin());
        session.end();
        assertTrue(session.tryBegin());
    }
}
