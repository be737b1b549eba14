package com.flagship.wager_ledger.wizard;

/**
 * Input that does not fit the session's current step. The session is left unchanged.
 */
public class UnexpectedInputException extends IllegalStateException {

    private final WizardStep step;

    public UnexpectedInputException(WizardStep step, String message) {
        super(message);
        this.step = step;
    }

    public WizardStep getStep() {
        return step;
    }
}
