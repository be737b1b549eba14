package com.flagship.wager_ledger.presenter;

/**
 * Raised when a result notice could not be delivered. Unchecked so it escapes the event
 * handler and the record is redelivered.
 */
public class NoticeDeliveryException extends RuntimeException {

    public NoticeDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
