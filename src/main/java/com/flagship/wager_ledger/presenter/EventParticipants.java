package com.flagship.wager_ledger.presenter;

import lombok.Value;

import java.util.List;

/**
 * Players on each side of a scheduled event. Side A is the home team, side B the away team.
 */
@Value
public class EventParticipants {
    List<String> sideA;
    List<String> sideB;

    public static EventParticipants none() {
        return new EventParticipants(List.of(), List.of());
    }

    public boolean isEmpty() {
        return sideA.isEmpty() && sideB.isEmpty();
    }
}
