package com.flagship.wager_ledger.wager;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Row of the wager_legs collection table. Legs never change after the first write.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LegEmbeddable {

    @Column(name = "league", length = 64)
    private String league;

    @Enumerated(EnumType.STRING)
    @Column(name = "line_type", nullable = false, length = 32)
    private LineType lineType;

    @Column(name = "event_ref", length = 128)
    private String eventRef;

    @Column(name = "participant", nullable = false)
    private String participant;

    @Column(name = "opponent", nullable = false)
    private String opponent;

    @Column(name = "market", nullable = false, length = 512)
    private String market;

    @Column(name = "american_odds", nullable = false)
    private int americanOdds;

    static LegEmbeddable fromDomain(Leg leg) {
        return new LegEmbeddable(
            leg.getLeague(),
            leg.getLineType(),
            leg.getEventRef(),
            leg.getParticipant(),
            leg.getOpponent(),
            leg.getMarket(),
            leg.getAmericanOdds()
        );
    }

    Leg toDomain() {
        return Leg.builder()
            .league(league)
            .lineType(lineType)
            .eventRef(eventRef)
            .participant(participant)
            .opponent(opponent)
            .market(market)
            .americanOdds(americanOdds)
            .build();
    }
}
