package com.flagship.wager_ledger.wizard;

/**
 * The draft is missing something the ledger requires (legs, stake or destination).
 */
public class IncompleteWagerException extends IllegalStateException {

    public IncompleteWagerException(String message) {
        super(message);
    }
}
