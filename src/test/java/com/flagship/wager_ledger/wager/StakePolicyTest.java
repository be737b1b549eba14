package com.flagship.wager_ledger.wager;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StakePolicyTest {

    @Test
    @DisplayName("Allowed stakes walk the range in increments, both ends included")
    void allowedStakes() {
        StakePolicy policy = new StakePolicy(new BigDecimal("0.5"), new BigDecimal("3.0"), new BigDecimal("0.5"));

        List<BigDecimal> stakes = policy.allowedStakes();

        assertEquals(6, stakes.size());
        assertEquals(0, new BigDecimal("0.5").compareTo(stakes.get(0)));
        assertEquals(0, new BigDecimal("3.0").compareTo(stakes.get(5)));
    }

    @Test
    @DisplayName("A range that does not land on the maximum stops below it")
    void unevenRange() {
        StakePolicy policy = new StakePolicy(new BigDecimal("1"), new BigDecimal("2.5"), new BigDecimal("1"));

        assertEquals(List.of(new BigDecimal("1"), new BigDecimal("2")), policy.allowedStakes());
    }

    @Test
    @DisplayName("Invalid bounds are rejected")
    void invalidBounds() {
        assertThrows(IllegalArgumentException.class,
                () -> new StakePolicy(BigDecimal.ZERO, BigDecimal.ONE, new BigDecimal("0.5")));
        assertThrows(IllegalArgumentException.class,
                () -> new StakePolicy(BigDecimal.ONE, new BigDecimal("0.5"), new BigDecimal("0.5")));
        assertThrows(IllegalArgumentException.class,
                () -> new StakePolicy(BigDecimal.ONE, BigDecimal.TEN, BigDecimal.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> new StakePolicy(null, BigDecimal.TEN, BigDecimal.ONE));
    }
}
