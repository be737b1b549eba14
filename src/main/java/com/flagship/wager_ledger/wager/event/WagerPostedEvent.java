package com.flagship.wager_ledger.wager.event;

import com.flagship.wager_ledger.wager.Wager;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published once a confirmed wager has been rendered to its destination.
 */
@Value
public class WagerPostedEvent implements WagerEvent {
    UUID eventId;
    UUID wagerId;
    String ownerId;
    String groupId;
    String wagerType;
    int legCount;
    BigDecimal stake;
    BigDecimal price;
    String destination;
    String postedMessageRef;
    Instant occurredAt;

    public static final String EVENT_TYPE = "WagerPosted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static WagerPostedEvent fromWager(Wager wager, Instant now) {
        return new WagerPostedEvent(
            UUID.randomUUID(),
            wager.getId(),
            wager.getOwnerId(),
            wager.getGroupId(),
            wager.getType().name(),
            wager.getLegs().size(),
            wager.getStake(),
            wager.getPrice(),
            wager.getDestination(),
            wager.getPostedMessageRef(),
            now
        );
    }
}
