package com.flagship.wager_ledger.wizard;

import com.flagship.wager_ledger.odds.InvalidOddsException;
import com.flagship.wager_ledger.odds.OddsMath;
import com.flagship.wager_ledger.presenter.ScheduledEvent;
import com.flagship.wager_ledger.wager.Leg;
import com.flagship.wager_ledger.wager.LineType;
import com.flagship.wager_ledger.wager.WagerType;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One user's placement attempt, as a finite state machine over {@link WizardStep}.
 *
 * The session only knows about its own data. Prompts (and the lookups needed to build
 * them) come from {@link WizardController}, which records the last prompt here so that
 * selections can be checked against what was actually offered.
 *
 * Transitions run one at a time: callers must hold the in-flight slot from
 * {@link #tryBegin()} while calling any mutating method.
 */
public class WizardSession {

    static final String OTHER_LEAGUE = "Other";
    static final String MANUAL_EVENT = "manual";
    static final String ADD_LEG = "add_leg";
    static final String FINALIZE = "finalize";
    static final String CONFIRM = "confirm";
    static final String EDIT_STAKE = "edit_stake";
    static final String EDIT_DESTINATION = "edit_destination";

    static final String FIELD_TEAM = "team";
    static final String FIELD_PLAYER = "player";
    static final String FIELD_OPPONENT = "opponent";
    static final String FIELD_LINE = "line";
    static final String FIELD_ODDS = "odds";

    private final UUID id;
    private final String ownerId;
    private final String groupId;
    private final Duration idleTimeout;
    private final DraftWager draft;
    private final AtomicBoolean inFlight = new AtomicBoolean(false);

    private volatile WizardStep step = WizardStep.SELECT_LINE_TYPE;
    private volatile Instant lastActivity;
    private StepPrompt currentPrompt;
    private final Map<String, ScheduledEvent> offeredEvents = new LinkedHashMap<>();

    WizardSession(UUID id, String ownerId, String groupId, WagerType type, Duration idleTimeout, Instant now) {
        this.id = id;
        this.ownerId = ownerId;
        this.groupId = groupId;
        this.idleTimeout = idleTimeout;
        this.draft = new DraftWager(type);
        this.lastActivity = now;
    }

    public UUID getId() {
        return id;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public String getGroupId() {
        return groupId;
    }

    public WagerType getType() {
        return draft.getType();
    }

    public WizardStep getStep() {
        return step;
    }

    DraftWager getDraft() {
        return draft;
    }

    StepPrompt getCurrentPrompt() {
        return currentPrompt;
    }

    // ==================== Single flight ====================

    /**
     * Claims the session for one transition. Returns false if another input holds it;
     * that input is dropped, not queued.
     */
    boolean tryBegin() {
        return inFlight.compareAndSet(false, true);
    }

    void end() {
        inFlight.set(false);
    }

    // ==================== Idle timeout ====================

    boolean isExpired(Instant now) {
        return !now.isBefore(lastActivity.plus(idleTimeout));
    }

    void touch(Instant now) {
        this.lastActivity = now;
    }

    Instant getLastActivity() {
        return lastActivity;
    }

    // ==================== Prompt bookkeeping ====================

    void present(StepPrompt prompt) {
        this.currentPrompt = prompt;
    }

    void offerEvents(List<ScheduledEvent> events) {
        offeredEvents.clear();
        for (ScheduledEvent event : events) {
            offeredEvents.put(event.getEventRef(), event);
        }
    }

    /**
     * Captures everything an input may change, so a transition that fails halfway can be undone.
     */
    Checkpoint checkpoint() {
        return new Checkpoint(step, currentPrompt, new LinkedHashMap<>(offeredEvents), draft.snapshot());
    }

    void rollback(Checkpoint checkpoint) {
        step = checkpoint.step();
        currentPrompt = checkpoint.prompt();
        offeredEvents.clear();
        offeredEvents.putAll(checkpoint.offeredEvents());
        draft.restore(checkpoint.draft());
    }

    /**
     * Skips a lookup step that has nothing to offer and moves on to free-text leg entry.
     */
    void fallThroughToLegDetails() {
        if (step == WizardStep.SELECT_EVENT) {
            draft.setEvent(null);
        } else if (step == WizardStep.SELECT_PARTICIPANT) {
            draft.setParticipant(null);
        } else {
            throw new IllegalStateException("Nothing to fall through from " + step);
        }
        step = WizardStep.ENTER_LEG_DETAILS;
    }

    // ==================== Terminal transitions ====================

    void markConfirmed() {
        step = WizardStep.CONFIRMED;
    }

    void markCancelled() {
        step = WizardStep.CANCELLED;
    }

    void markTimedOut() {
        step = WizardStep.TIMED_OUT;
    }

    // ==================== Input handling ====================

    /**
     * Applies one selection or form to the current step.
     *
     * Nothing changes when the input is rejected. Cancel and the final confirm are not
     * step inputs and are handled by the controller.
     *
     * @throws UnexpectedInputException if the input does not fit the current step
     * @throws InvalidOddsException if a leg form carries unusable odds
     * @throws IncompleteWagerException if the wager would reach review without what it needs
     */
    void accept(WizardInput input, int maxOddsMagnitude) {
        if (step.isTerminal()) {
            throw new UnexpectedInputException(step, "Session is already closed");
        }
        if (input.getKind() == WizardInput.Kind.CANCEL) {
            throw new UnexpectedInputException(step, "Cancel is handled by the controller");
        }
        if (step.expectsForm() != (input.getKind() == WizardInput.Kind.FORM)) {
            throw new UnexpectedInputException(step, step.expectsForm()
                    ? "Fill in the leg details form to continue"
                    : "Pick one of the offered options to continue");
        }
        if (input.getKind() == WizardInput.Kind.SELECT) {
            requireOffered(input.getValue());
        }

        switch (step) {
            case SELECT_LINE_TYPE -> {
                draft.setLineType(LineType.fromCode(input.getValue())
                        .orElseThrow(() -> new UnexpectedInputException(step, "Unknown line type")));
                step = WizardStep.SELECT_LEAGUE;
            }
            case SELECT_LEAGUE -> {
                draft.setLeague(input.getValue());
                draft.setEvent(null);
                step = OTHER_LEAGUE.equals(input.getValue()) ? WizardStep.ENTER_LEG_DETAILS : WizardStep.SELECT_EVENT;
            }
            case SELECT_EVENT -> {
                if (MANUAL_EVENT.equals(input.getValue())) {
                    draft.setEvent(null);
                    step = WizardStep.ENTER_LEG_DETAILS;
                } else {
                    ScheduledEvent event = offeredEvents.get(input.getValue());
                    if (event == null) {
                        throw new UnexpectedInputException(step, "That event is no longer offered");
                    }
                    draft.setEvent(event);
                    step = draft.getLineType() == LineType.PLAYER_PROP
                            ? WizardStep.SELECT_PARTICIPANT
                            : WizardStep.ENTER_LEG_DETAILS;
                }
            }
            case SELECT_PARTICIPANT -> {
                draft.setParticipant(input.getValue());
                step = WizardStep.ENTER_LEG_DETAILS;
            }
            case ENTER_LEG_DETAILS -> {
                Leg leg = buildLeg(input, maxOddsMagnitude);
                draft.addLeg(leg);
                step = draft.getType() == WagerType.PARLAY ? WizardStep.LEG_DECISION : WizardStep.SELECT_STAKE;
            }
            case LEG_DECISION -> {
                if (ADD_LEG.equals(input.getValue())) {
                    draft.resetLeg();
                    step = WizardStep.SELECT_LINE_TYPE;
                } else if (FINALIZE.equals(input.getValue()) && draft.canFinalize()) {
                    step = WizardStep.SELECT_STAKE;
                } else {
                    throw new UnexpectedInputException(step, "Add another leg before finalizing the parlay");
                }
            }
            case SELECT_STAKE -> {
                BigDecimal stake = new BigDecimal(input.getValue());
                if (draft.getWagerId() != null) {
                    draft.checkComplete(stake, draft.getDestination());
                    draft.setStake(stake);
                    step = WizardStep.REVIEW_AND_CONFIRM;
                } else {
                    draft.setStake(stake);
                    step = WizardStep.SELECT_DESTINATION;
                }
            }
            case SELECT_DESTINATION -> {
                draft.checkComplete(draft.getStake(), input.getValue());
                draft.setDestination(input.getValue());
                step = WizardStep.REVIEW_AND_CONFIRM;
            }
            case REVIEW_AND_CONFIRM -> {
                if (EDIT_STAKE.equals(input.getValue())) {
                    step = WizardStep.SELECT_STAKE;
                } else if (EDIT_DESTINATION.equals(input.getValue())) {
                    step = WizardStep.SELECT_DESTINATION;
                } else {
                    throw new UnexpectedInputException(step, "Confirm is handled by the controller");
                }
            }
            default -> throw new UnexpectedInputException(step, "No input expected at " + step);
        }
    }

    /**
     * Fields the leg form asks for, given what has been selected for this leg so far.
     */
    List<StepPrompt.FormField> legFormFields() {
        ScheduledEvent event = draft.getEvent();
        boolean playerProp = draft.getLineType() == LineType.PLAYER_PROP;
        StepPrompt.FormField line = new StepPrompt.FormField(FIELD_LINE,
                playerProp ? "Prop (e.g. Over 24.5 points)" : "Line (e.g. -3.5, Over 210.5, Moneyline)", true);
        StepPrompt.FormField odds = new StepPrompt.FormField(FIELD_ODDS, "Odds (e.g. -110 or +150)", true);

        if (event == null) {
            StepPrompt.FormField side = playerProp
                    ? new StepPrompt.FormField(FIELD_PLAYER, "Player", true)
                    : new StepPrompt.FormField(FIELD_TEAM, "Team or competitor", true);
            return List.of(side, new StepPrompt.FormField(FIELD_OPPONENT, "Opponent (optional)", false), line, odds);
        }
        if (!playerProp) {
            return List.of(new StepPrompt.FormField(FIELD_TEAM,
                    "Team (" + event.getHomeTeam() + " or " + event.getAwayTeam() + ")", true), line, odds);
        }
        if (draft.getParticipant() == null) {
            return List.of(new StepPrompt.FormField(FIELD_PLAYER, "Player", true), line, odds);
        }
        return List.of(line, odds);
    }

    private Leg buildLeg(WizardInput input, int maxOddsMagnitude) {
        for (StepPrompt.FormField field : legFormFields()) {
            if (field.isRequired() && input.field(field.getName()) == null) {
                throw new UnexpectedInputException(step, "Missing required field: " + field.getLabel());
            }
        }
        int americanOdds = parseOdds(input.field(FIELD_ODDS), maxOddsMagnitude);

        ScheduledEvent event = draft.getEvent();
        LineType lineType = draft.getLineType();
        String participant;
        String opponent;
        if (event == null) {
            participant = lineType == LineType.PLAYER_PROP ? input.field(FIELD_PLAYER) : input.field(FIELD_TEAM);
            String given = input.field(FIELD_OPPONENT);
            opponent = given != null ? given : Leg.UNKNOWN_OPPONENT;
        } else if (lineType == LineType.PLAYER_PROP) {
            participant = draft.getParticipant() != null ? draft.getParticipant() : input.field(FIELD_PLAYER);
            opponent = event.label();
        } else {
            participant = input.field(FIELD_TEAM);
            if (participant.equalsIgnoreCase(event.getHomeTeam())) {
                participant = event.getHomeTeam();
                opponent = event.getAwayTeam();
            } else if (participant.equalsIgnoreCase(event.getAwayTeam())) {
                participant = event.getAwayTeam();
                opponent = event.getHomeTeam();
            } else {
                throw new UnexpectedInputException(step,
                        "Team must be " + event.getHomeTeam() + " or " + event.getAwayTeam());
            }
        }

        return Leg.builder()
                .league(draft.getLeague())
                .lineType(lineType)
                .eventRef(event == null ? null : event.getEventRef())
                .participant(participant)
                .opponent(opponent)
                .market(input.field(FIELD_LINE))
                .americanOdds(americanOdds)
                .build();
    }

    static int parseOdds(String raw, int maxOddsMagnitude) {
        if (raw == null) {
            throw new InvalidOddsException("Odds are required");
        }
        String digits = raw.startsWith("+") ? raw.substring(1) : raw;
        int odds;
        try {
            odds = Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new InvalidOddsException("Odds must be a whole number such as -110 or +150, got '" + raw + "'");
        }
        if (!OddsMath.isValidAmerican(odds)) {
            throw new InvalidOddsException(odds);
        }
        if (Math.abs((long) odds) > maxOddsMagnitude) {
            throw new InvalidOddsException(String.format(
                    "Odds %+d are outside the accepted range of -%d to +%d", odds, maxOddsMagnitude, maxOddsMagnitude));
        }
        return odds;
    }

    private void requireOffered(String value) {
        if (value == null || currentPrompt == null || !currentPrompt.offers(value)) {
            throw new UnexpectedInputException(step, "That option is not available at this step");
        }
    }

    record Checkpoint(WizardStep step, StepPrompt prompt, Map<String, ScheduledEvent> offeredEvents,
                      DraftWager.Selections draft) {
    }
}
