package com.flagship.wager_ledger.presenter;

/**
 * Raised when a wager artifact could not be rendered or posted. The wager stays confirmed
 * and the user may retry.
 */
public class PostFailureException extends Exception {

    public PostFailureException(String message) {
        super(message);
    }

    public PostFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
