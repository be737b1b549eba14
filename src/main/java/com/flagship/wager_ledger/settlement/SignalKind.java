package com.flagship.wager_ledger.settlement;

import com.flagship.wager_ledger.wager.WagerStatus;

import java.util.Arrays;
import java.util.Optional;

/**
 * Outcome signals an owner can attach to a posted wager, and the status each one implies.
 */
public enum SignalKind {
    WON(WagerStatus.SETTLED_WON),
    LOST(WagerStatus.SETTLED_LOST),
    PUSH(WagerStatus.SETTLED_PUSH),
    VOID(WagerStatus.VOIDED);

    private final WagerStatus settledStatus;

    SignalKind(WagerStatus settledStatus) {
        this.settledStatus = settledStatus;
    }

    public WagerStatus getSettledStatus() {
        return settledStatus;
    }

    /**
     * VOID moves no units, so it writes no settlement record.
     */
    public boolean writesRecord() {
        return this != VOID;
    }

    public static Optional<SignalKind> fromName(String name) {
        return Arrays.stream(values())
                .filter(kind -> kind.name().equalsIgnoreCase(name))
                .findFirst();
    }
}
