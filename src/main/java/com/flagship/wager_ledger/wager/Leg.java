package com.flagship.wager_ledger.wager;

import lombok.Builder;
import lombok.Value;

/**
 * One proposition within a wager.
 *
 * eventRef is null for manually described events. opponent is "unknown" when the
 * manual entry names a single competitor.
 */
@Value
@Builder
public class Leg {

    public static final String UNKNOWN_OPPONENT = "unknown";

    String league;
    LineType lineType;
    String eventRef;
    String participant;
    String opponent;
    String market;
    int americanOdds;

    public String describe() {
        return String.format("%s vs %s: %s (%+d)", participant, opponent, market, americanOdds);
    }
}
