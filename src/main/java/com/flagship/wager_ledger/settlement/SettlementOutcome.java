package com.flagship.wager_ledger.settlement;

/**
 * What a signal did. Only APPLIED changed the ledger; the rest are expected no-ops.
 */
public enum SettlementOutcome {
    APPLIED,
    NOT_FOUND,
    STALE_STATE,
    IGNORED_ACTOR
}
