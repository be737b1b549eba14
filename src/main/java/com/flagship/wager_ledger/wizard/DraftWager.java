package com.flagship.wager_ledger.wizard;

import com.flagship.wager_ledger.odds.InvalidPriceException;
import com.flagship.wager_ledger.odds.OddsMath;
import com.flagship.wager_ledger.presenter.ScheduledEvent;
import com.flagship.wager_ledger.wager.Leg;
import com.flagship.wager_ledger.wager.LineType;
import com.flagship.wager_ledger.wager.WagerDraft;
import com.flagship.wager_ledger.wager.WagerType;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * The wager a session is building. Owned by one session and only touched while that
 * session holds its in-flight slot.
 *
 * Leg selections (line type, league, event, participant) describe the leg being entered
 * and are cleared when another leg is started.
 */
@Getter
@Setter(AccessLevel.PACKAGE)
class DraftWager {

    private final WagerType type;
    private final List<Leg> legs = new ArrayList<>();

    private LineType lineType;
    private String league;
    private ScheduledEvent event;
    private String participant;

    private BigDecimal stake;
    private String destination;

    @Setter(AccessLevel.NONE)
    private UUID wagerId;
    @Setter(AccessLevel.NONE)
    private boolean confirmAttempted;
    // Set once the presenter has posted the artifact, so a retry records it instead of posting again.
    @Setter(AccessLevel.NONE)
    private String postedRef;

    DraftWager(WagerType type) {
        this.type = type;
    }

    List<Leg> getLegs() {
        return List.copyOf(legs);
    }

    int legCount() {
        return legs.size();
    }

    /**
     * @throws InvalidPriceException if the leg would push the combined price above
     *         {@link OddsMath#MAX_PRICE}
     */
    void addLeg(Leg leg) {
        if (wagerId != null) {
            throw new IllegalStateException("Legs are fixed once the wager is in the ledger");
        }
        List<Integer> odds = new ArrayList<>(legs.size() + 1);
        legs.forEach(existing -> odds.add(existing.getAmericanOdds()));
        odds.add(leg.getAmericanOdds());
        OddsMath.priceForLegs(odds);
        legs.add(leg);
        resetLeg();
    }

    void resetLeg() {
        lineType = null;
        league = null;
        event = null;
        participant = null;
    }

    boolean canFinalize() {
        return legs.size() >= type.getMinimumLegs();
    }

    void allocated(UUID wagerId) {
        this.wagerId = wagerId;
    }

    void markConfirmAttempted() {
        this.confirmAttempted = true;
    }

    void posted(String artifactRef) {
        this.postedRef = artifactRef;
    }

    Selections snapshot() {
        return new Selections(List.copyOf(legs), lineType, league, event, participant, stake, destination);
    }

    /**
     * Puts back the choices captured by {@link #snapshot()}. The ledger id and the confirm
     * and post markers are left alone; they track rows and artifacts that already exist.
     */
    void restore(Selections selections) {
        legs.clear();
        legs.addAll(selections.legs());
        lineType = selections.lineType();
        league = selections.league();
        event = selections.event();
        participant = selections.participant();
        stake = selections.stake();
        destination = selections.destination();
    }

    BigDecimal price() {
        return OddsMath.priceForLegs(legs.stream().map(Leg::getAmericanOdds).toList());
    }

    /**
     * @throws IncompleteWagerException if the wager could not be written with these values
     */
    void checkComplete(BigDecimal candidateStake, String candidateDestination) {
        if (legs.isEmpty()) {
            throw new IncompleteWagerException("Add at least one leg before reviewing the wager");
        }
        if (!canFinalize()) {
            throw new IncompleteWagerException(String.format(
                    "A %s needs at least %d legs, this one has %d",
                    type.name().toLowerCase(), type.getMinimumLegs(), legs.size()));
        }
        if (candidateStake == null) {
            throw new IncompleteWagerException("Choose a stake before reviewing the wager");
        }
        if (candidateDestination == null) {
            throw new IncompleteWagerException("Choose where to post the wager before reviewing it");
        }
    }

    WagerDraft toWagerDraft(String ownerId, String groupId) {
        checkComplete(stake, destination);
        return new WagerDraft(ownerId, groupId, type, legs, stake, price(), destination);
    }

    String preview() {
        StringBuilder sb = new StringBuilder();
        if (type == WagerType.PARLAY) {
            sb.append("Parlay (").append(legs.size()).append(legs.size() == 1 ? " leg)" : " legs)");
        } else {
            sb.append("Straight");
        }
        if (!legs.isEmpty()) {
            BigDecimal price = price();
            sb.append(String.format(" @ %+d (%s)", OddsMath.toAmerican(price), price.toPlainString()));
        }
        for (int i = 0; i < legs.size(); i++) {
            sb.append('\n').append(i + 1).append(". ").append(legs.get(i).describe());
        }
        if (stake != null) {
            sb.append("\nStake: ").append(stake.stripTrailingZeros().toPlainString()).append(" units");
        }
        if (destination != null) {
            sb.append("\nPost to: ").append(destination);
        }
        return sb.toString();
    }

    record Selections(List<Leg> legs, LineType lineType, String league, ScheduledEvent event,
                      String participant, BigDecimal stake, String destination) {
    }
}
