package com.flagship.wager_ledger.ledger;

import java.util.UUID;

public class WagerNotFoundException extends RuntimeException {

    public WagerNotFoundException(UUID wagerId) {
        super("Wager not found: " + wagerId);
    }
}
