package com.flagship.wager_ledger.wager;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Snapshot of a wizard's accumulated wager, handed to the ledger for its first write.
 * The ledger allocates the id.
 */
@Value
public class WagerDraft {
    String ownerId;
    String groupId;
    WagerType type;
    List<Leg> legs;
    BigDecimal stake;
    BigDecimal price;
    String destination;

    public WagerDraft(String ownerId, String groupId, WagerType type, List<Leg> legs,
                      BigDecimal stake, BigDecimal price, String destination) {
        this.ownerId = ownerId;
        this.groupId = groupId;
        this.type = type;
        this.legs = List.copyOf(legs);
        this.stake = stake;
        this.price = price;
        this.destination = destination;
    }
}
