package com.flagship.wager_ledger.wizard;

/**
 * Steps of a placement session. Every non-terminal step except ENTER_LEG_DETAILS expects a
 * selection; ENTER_LEG_DETAILS expects a submitted form.
 */
public enum WizardStep {
    SELECT_LINE_TYPE,
    SELECT_LEAGUE,
    SELECT_EVENT,
    SELECT_PARTICIPANT,
    ENTER_LEG_DETAILS,
    LEG_DECISION,
    SELECT_STAKE,
    SELECT_DESTINATION,
    REVIEW_AND_CONFIRM,
    CONFIRMED,
    CANCELLED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this == CONFIRMED || this == CANCELLED || this == TIMED_OUT;
    }

    public boolean expectsForm() {
        return this == ENTER_LEG_DETAILS;
    }
}
