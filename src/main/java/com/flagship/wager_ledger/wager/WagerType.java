package com.flagship.wager_ledger.wager;

/**
 * STRAIGHT wagers carry exactly one leg, PARLAY wagers at least two.
 */
public enum WagerType {
    STRAIGHT(1),
    PARLAY(2);

    private final int minimumLegs;

    WagerType(int minimumLegs) {
        this.minimumLegs = minimumLegs;
    }

    public int getMinimumLegs() {
        return minimumLegs;
    }
}
