package com.flagship.wager_ledger.wager.event;

import com.flagship.wager_ledger.wager.Wager;
import com.flagship.wager_ledger.wager.WagerStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a posted wager moves into a settled status.
 *
 * resultValue is null for VOIDED, where no settlement record is written.
 */
@Value
public class WagerSettledEvent implements WagerEvent {
    UUID eventId;
    UUID wagerId;
    String ownerId;
    String groupId;
    String settledStatus;
    BigDecimal stake;
    BigDecimal price;
    BigDecimal resultValue;
    String postedMessageRef;
    String destination;
    Instant occurredAt;

    public static final String EVENT_TYPE = "WagerSettled";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static WagerSettledEvent fromWager(Wager wager, WagerStatus settledStatus,
                                              BigDecimal resultValue, Instant now) {
        return new WagerSettledEvent(
            UUID.randomUUID(),
            wager.getId(),
            wager.getOwnerId(),
            wager.getGroupId(),
            settledStatus.name(),
            wager.getStake(),
            wager.getPrice(),
            resultValue,
            wager.getPostedMessageRef(),
            wager.getDestination(),
            now
        );
    }
}
