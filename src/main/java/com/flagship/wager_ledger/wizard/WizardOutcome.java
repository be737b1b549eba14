package com.flagship.wager_ledger.wizard;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.UUID;

/**
 * Result of feeding one input to a session.
 *
 * ERROR outcomes leave the session where it was and carry the prompt to show again.
 * DROPPED means another input for the same session was still being processed.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WizardOutcome {

    public enum Kind {
        PROMPT,
        CONFIRMED,
        CANCELLED,
        TIMED_OUT,
        ERROR,
        DROPPED
    }

    public static final String SESSION_NOT_FOUND = "SESSION_NOT_FOUND";
    public static final String NOT_SESSION_OWNER = "NOT_SESSION_OWNER";
    public static final String UNEXPECTED_INPUT = "UNEXPECTED_INPUT";
    public static final String INVALID_ODDS = "INVALID_ODDS";
    public static final String INVALID_PRICE = "INVALID_PRICE";
    public static final String INCOMPLETE_WAGER = "INCOMPLETE_WAGER";
    public static final String NO_DESTINATION = "NO_DESTINATION";
    public static final String POST_FAILED = "POST_FAILED";
    public static final String UNAVAILABLE = "UNAVAILABLE";

    Kind kind;
    UUID sessionId;
    StepPrompt prompt;
    UUID wagerId;
    String artifactRef;
    String errorCode;
    String message;

    public static WizardOutcome prompt(UUID sessionId, StepPrompt prompt) {
        return new WizardOutcome(Kind.PROMPT, sessionId, prompt, null, null, null, null);
    }

    public static WizardOutcome confirmed(UUID sessionId, UUID wagerId, String artifactRef) {
        return new WizardOutcome(Kind.CONFIRMED, sessionId, null, wagerId, artifactRef, null,
                "Wager posted");
    }

    public static WizardOutcome cancelled(UUID sessionId) {
        return new WizardOutcome(Kind.CANCELLED, sessionId, null, null, null, null, "Wager cancelled");
    }

    public static WizardOutcome timedOut(UUID sessionId) {
        return new WizardOutcome(Kind.TIMED_OUT, sessionId, null, null, null, null,
                "Session expired after inactivity");
    }

    public static WizardOutcome error(UUID sessionId, String errorCode, String message, StepPrompt prompt) {
        return new WizardOutcome(Kind.ERROR, sessionId, prompt, null, null, errorCode, message);
    }

    public static WizardOutcome dropped(UUID sessionId) {
        return new WizardOutcome(Kind.DROPPED, sessionId, null, null, null, null,
                "Previous input is still being processed");
    }

    public boolean isTerminal() {
        return kind == Kind.CONFIRMED || kind == Kind.CANCELLED || kind == Kind.TIMED_OUT;
    }
}
