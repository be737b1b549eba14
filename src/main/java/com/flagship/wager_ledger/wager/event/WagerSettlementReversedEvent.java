package com.flagship.wager_ledger.wager.event;

import com.flagship.wager_ledger.wager.Wager;
import com.flagship.wager_ledger.wager.WagerStatus;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a retracted signal returns a settled wager to POSTED.
 */
@Value
public class WagerSettlementReversedEvent implements WagerEvent {
    UUID eventId;
    UUID wagerId;
    String ownerId;
    String groupId;
    String reversedStatus;
    String postedMessageRef;
    String destination;
    Instant occurredAt;

    public static final String EVENT_TYPE = "WagerSettlementReversed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static WagerSettlementReversedEvent fromWager(Wager wager, WagerStatus reversedStatus, Instant now) {
        return new WagerSettlementReversedEvent(
            UUID.randomUUID(),
            wager.getId(),
            wager.getOwnerId(),
            wager.getGroupId(),
            reversedStatus.name(),
            wager.getPostedMessageRef(),
            wager.getDestination(),
            now
        );
    }
}
