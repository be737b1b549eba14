package com.flagship.wager_ledger.odds;

/**
 * Thrown when American odds fall inside the band that has no valid price (|odds| < 100)
 * or outside the accepted range.
 */
public class InvalidOddsException extends IllegalArgumentException {

    public InvalidOddsException(int americanOdds) {
        super(String.format("Odds %+d are invalid: American odds must be -100 or lower, or +100 or higher",
                americanOdds));
    }

    public InvalidOddsException(String message) {
        super(message);
    }
}
