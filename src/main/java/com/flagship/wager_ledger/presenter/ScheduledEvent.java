package com.flagship.wager_ledger.presenter;

import lombok.Value;

import java.time.Instant;

/**
 * An upcoming game offered in the event step.
 */
@Value
public class ScheduledEvent {
    String eventRef;
    String league;
    String homeTeam;
    String awayTeam;
    Instant startsAt;

    public String label() {
        return awayTeam + " @ " + homeTeam;
    }
}
