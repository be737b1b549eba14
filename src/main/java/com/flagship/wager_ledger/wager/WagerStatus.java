package com.flagship.wager_ledger.wager;

/**
 * Lifecycle status of a wager.
 *
 * DRAFT only exists inside a wizard session and is never written to the ledger.
 * Transitions:
 * - CONFIRMED → POSTED
 * - POSTED → SETTLED_WON / SETTLED_LOST / SETTLED_PUSH / VOIDED
 * - any settled status → POSTED (retraction of the signal that caused it)
 */
public enum WagerStatus {
    DRAFT,
    CONFIRMED,
    POSTED,
    SETTLED_WON,
    SETTLED_LOST,
    SETTLED_PUSH,
    VOIDED;

    /**
     * True for the statuses reached through an outcome signal.
     */
    public boolean isSettled() {
        return this == SETTLED_WON || this == SETTLED_LOST || this == SETTLED_PUSH || this == VOIDED;
    }
}
