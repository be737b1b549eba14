package com.flagship.wager_ledger.ledger;

import com.flagship.wager_ledger.wager.WagerStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One unit-of-account movement applied to a wager.
 *
 * The sum of resultValue over a wager's records is its current net effect. Reversal
 * deletes the record rather than flagging it.
 */
@Value
public class SettlementRecord {
    UUID id;
    UUID wagerId;
    WagerStatus settledStatus;
    BigDecimal stakeApplied;
    BigDecimal priceApplied;
    BigDecimal resultValue;
    Instant createdAt;
}
