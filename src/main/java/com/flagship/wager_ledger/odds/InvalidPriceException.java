package com.flagship.wager_ledger.odds;

import java.math.BigDecimal;

public class InvalidPriceException extends IllegalArgumentException {

    public InvalidPriceException(BigDecimal price) {
        super("Decimal price must be greater than 1.0, got " + price);
    }

    public InvalidPriceException(String message) {
        super(message);
    }
}
