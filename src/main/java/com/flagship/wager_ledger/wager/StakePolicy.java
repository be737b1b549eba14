package com.flagship.wager_ledger.wager;

import lombok.Value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Allowed stakes for a community: a closed range walked in fixed increments.
 */
@Value
public class StakePolicy {
    BigDecimal min;
    BigDecimal max;
    BigDecimal increment;

    public StakePolicy(BigDecimal min, BigDecimal max, BigDecimal increment) {
        if (min == null || max == null || increment == null) {
            throw new IllegalArgumentException("Stake bounds and increment are required");
        }
        if (min.signum() <= 0 || increment.signum() <= 0) {
            throw new IllegalArgumentException("Stake minimum and increment must be positive");
        }
        if (max.compareTo(min) < 0) {
            throw new IllegalArgumentException("Stake maximum must not be below the minimum");
        }
        this.min = min;
        this.max = max;
        this.increment = increment;
    }

    /**
     * Every allowed stake in ascending order.
     */
    public List<BigDecimal> allowedStakes() {
        List<BigDecimal> stakes = new ArrayList<>();
        for (BigDecimal s = min; s.compareTo(max) <= 0; s = s.add(increment)) {
            stakes.add(s);
        }
        return stakes;
    }
}
