package com.flagship.wager_ledger.ledger;

import com.flagship.wager_ledger.wager.WagerStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Append-only trail of settlement records being written and removed.
 * resultValue is null for transitions that carry no record (void).
 */
@Value
public class SettlementAuditEntry {
    UUID wagerId;
    Action action;
    WagerStatus settledStatus;
    BigDecimal resultValue;
    Instant occurredAt;
    Long sequenceNumber;

    public enum Action {
        SETTLED,
        REVERSED
    }
}
