package com.flagship.wager_ledger.odds;

public class EmptyLegSetException extends IllegalArgumentException {

    public EmptyLegSetException() {
        super("Cannot price a wager without legs");
    }
}
