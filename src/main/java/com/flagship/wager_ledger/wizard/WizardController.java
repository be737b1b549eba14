package com.flagship.wager_ledger.wizard;

import com.flagship.wager_ledger.ledger.WagerLedger;
import com.flagship.wager_ledger.ledger.WagerNotFoundException;
import com.flagship.wager_ledger.observability.CorrelationContext;
import com.flagship.wager_ledger.observability.WagerMetrics;
import com.flagship.wager_ledger.odds.InvalidOddsException;
import com.flagship.wager_ledger.odds.InvalidPriceException;
import com.flagship.wager_ledger.presenter.Destination;
import com.flagship.wager_ledger.presenter.EventDataProvider;
import com.flagship.wager_ledger.presenter.EventParticipants;
import com.flagship.wager_ledger.presenter.PostFailureException;
import com.flagship.wager_ledger.presenter.Presenter;
import com.flagship.wager_ledger.presenter.ScheduledEvent;
import com.flagship.wager_ledger.wager.LineType;
import com.flagship.wager_ledger.wager.StakePolicy;
import com.flagship.wager_ledger.wager.Wager;
import com.flagship.wager_ledger.wager.WagerType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs placement sessions: creates them, feeds them inputs, builds their prompts, and
 * hands finished wagers to the ledger and the presenter.
 *
 * Key rules:
 * - One transition per session at a time; an input arriving while another is processed is dropped
 * - The wager is written to the ledger (CONFIRMED) the first time the session reaches review;
 *   later edits update stake and destination on the same id
 * - Cancel and idle timeout delete that row unless the user has already pressed confirm
 * - A failed post leaves the row CONFIRMED and the session at review so confirm can be retried
 * - A posted artifact is remembered on the draft; a retry after a ledger fault records it
 *   without posting a second one
 * - A transition that fails halfway (ledger or lookup fault) is rolled back to the step it started from
 *
 * Sessions for different users never share state and proceed independently.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WizardController {

    private final WagerLedger ledger;
    private final Presenter presenter;
    private final EventDataProvider eventData;
    private final WagerPostingService postingService;
    private final StakePolicy stakePolicy;
    private final WizardSettings settings;
    private final WagerMetrics metrics;
    private final Clock clock;

    private final Map<UUID, WizardSession> sessions = new ConcurrentHashMap<>();

    public SessionHandle createSession(String ownerId, String groupId) {
        return createSession(ownerId, groupId, WagerType.STRAIGHT);
    }

    /**
     * Starts a session at SELECT_LINE_TYPE. The first prompt is available from
     * {@link #current(SessionHandle)}.
     */
    public SessionHandle createSession(String ownerId, String groupId, WagerType type) {
        if (ownerId == null || ownerId.isBlank() || groupId == null || groupId.isBlank()) {
            throw new IllegalArgumentException("Owner and group are required to start a wager");
        }
        WizardSession session = new WizardSession(UUID.randomUUID(), ownerId, groupId, type,
                settings.timeoutFor(type), clock.instant());
        session.present(buildPrompt(session));
        sessions.put(session.getId(), session);
        metrics.recordSessionStarted(type.name());
        log.info("Started {} session {} for owner {} in group {}", type, session.getId(), ownerId, groupId);
        return new SessionHandle(session.getId(), ownerId);
    }

    /**
     * The prompt the session is waiting on, without changing anything.
     */
    public WizardOutcome current(SessionHandle handle) {
        WizardSession session = sessions.get(handle.getSessionId());
        if (session == null) {
            return WizardOutcome.error(handle.getSessionId(), WizardOutcome.SESSION_NOT_FOUND,
                    "No open wager session with this id", null);
        }
        if (!session.getOwnerId().equals(handle.getOwnerId())) {
            return WizardOutcome.error(handle.getSessionId(), WizardOutcome.NOT_SESSION_OWNER,
                    "This wager session belongs to another user", null);
        }
        return WizardOutcome.prompt(session.getId(), session.getCurrentPrompt());
    }

    /**
     * Feeds one input into a session.
     *
     * Validation failures and collaborator faults come back as ERROR outcomes with the
     * unchanged prompt; they do not throw.
     */
    public WizardOutcome advance(SessionHandle handle, WizardInput input) {
        WizardSession session = sessions.get(handle.getSessionId());
        if (session == null) {
            return WizardOutcome.error(handle.getSessionId(), WizardOutcome.SESSION_NOT_FOUND,
                    "No open wager session with this id", null);
        }
        if (!session.getOwnerId().equals(handle.getOwnerId())) {
            return WizardOutcome.error(session.getId(), WizardOutcome.NOT_SESSION_OWNER,
                    "This wager session belongs to another user", null);
        }
        if (!session.tryBegin()) {
            metrics.recordInputDropped();
            log.debug("Dropped overlapping input for session {}", session.getId());
            return WizardOutcome.dropped(session.getId());
        }

        MDC.put(CorrelationContext.SESSION_ID_MDC_KEY, session.getId().toString());
        try {
            if (session.getStep().isTerminal()) {
                return WizardOutcome.error(session.getId(), WizardOutcome.SESSION_NOT_FOUND,
                        "This wager session is already closed", null);
            }
            Instant now = clock.instant();
            if (session.isExpired(now)) {
                return expire(session);
            }
            session.touch(now);

            if (input.getKind() == WizardInput.Kind.CANCEL) {
                return cancel(session);
            }
            if (session.getStep() == WizardStep.REVIEW_AND_CONFIRM
                    && input.getKind() == WizardInput.Kind.SELECT
                    && WizardSession.CONFIRM.equals(input.getValue())) {
                return confirm(session);
            }

            WizardStep before = session.getStep();
            WizardSession.Checkpoint checkpoint = session.checkpoint();
            StepPrompt prompt;
            try {
                session.accept(input, settings.getMaxOddsMagnitude());
                if (session.getStep() == WizardStep.REVIEW_AND_CONFIRM) {
                    persistDraft(session);
                }
                prompt = buildPrompt(session);
            } catch (UnexpectedInputException e) {
                session.rollback(checkpoint);
                return reject(session, WizardOutcome.UNEXPECTED_INPUT, e.getMessage());
            } catch (InvalidOddsException e) {
                session.rollback(checkpoint);
                return reject(session, WizardOutcome.INVALID_ODDS, e.getMessage());
            } catch (InvalidPriceException e) {
                session.rollback(checkpoint);
                return reject(session, WizardOutcome.INVALID_PRICE, e.getMessage());
            } catch (IncompleteWagerException e) {
                session.rollback(checkpoint);
                return reject(session, WizardOutcome.INCOMPLETE_WAGER, e.getMessage());
            } catch (RuntimeException e) {
                session.rollback(checkpoint);
                log.error("Session {} could not leave {}, rolled back: {}", session.getId(), before, e.getMessage(), e);
                return reject(session, WizardOutcome.UNAVAILABLE,
                        "Something went wrong saving your choice. Please try again.");
            }
            session.present(prompt);
            log.debug("Session {} moved {} -> {}", session.getId(), before, session.getStep());

            if (session.getStep() == WizardStep.SELECT_DESTINATION && prompt.getOptions().isEmpty()) {
                return WizardOutcome.error(session.getId(), WizardOutcome.NO_DESTINATION,
                        "There is nowhere to post wagers in this group yet. Cancel and ask an admin to add a channel.",
                        prompt);
            }
            return WizardOutcome.prompt(session.getId(), prompt);
        } finally {
            MDC.remove(CorrelationContext.SESSION_ID_MDC_KEY);
            session.end();
        }
    }

    /**
     * Closes every session idle past its timeout. Sessions in the middle of a transition
     * are skipped and picked up by a later sweep.
     *
     * @return number of sessions expired
     */
    public int expireIdleSessions() {
        Instant now = clock.instant();
        int expired = 0;
        for (WizardSession session : sessions.values()) {
            if (!session.isExpired(now) || !session.tryBegin()) {
                continue;
            }
            try {
                if (!session.getStep().isTerminal() && session.isExpired(clock.instant())) {
                    expire(session);
                    expired++;
                }
            } finally {
                session.end();
            }
        }
        return expired;
    }

    public int openSessionCount() {
        return sessions.size();
    }

    Optional<WizardSession> findSession(UUID sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    // ==================== Terminal paths ====================

    private WizardOutcome cancel(WizardSession session) {
        discardUnconfirmedWager(session);
        session.markCancelled();
        close(session, "cancelled");
        log.info("Session {} cancelled at {} legs", session.getId(), session.getDraft().legCount());
        return WizardOutcome.cancelled(session.getId());
    }

    private WizardOutcome expire(WizardSession session) {
        discardUnconfirmedWager(session);
        session.markTimedOut();
        close(session, "timed_out");
        log.info("Session {} timed out (last activity {})", session.getId(), session.getLastActivity());
        return WizardOutcome.timedOut(session.getId());
    }

    private WizardOutcome confirm(WizardSession session) {
        DraftWager draft = session.getDraft();
        UUID wagerId = draft.getWagerId();
        if (wagerId == null) {
            return reject(session, WizardOutcome.INCOMPLETE_WAGER, "Review the wager before confirming it");
        }
        MDC.put(CorrelationContext.WAGER_ID_MDC_KEY, wagerId.toString());
        try {
            return confirmAndPost(session, draft, wagerId);
        } catch (RuntimeException e) {
            log.error("Confirming wager {} failed, session {} left at review: {}",
                    wagerId, session.getId(), e.getMessage(), e);
            return reject(session, WizardOutcome.UNAVAILABLE,
                    "Your wager could not be saved just now. Select confirm to try again.");
        } finally {
            MDC.remove(CorrelationContext.WAGER_ID_MDC_KEY);
        }
    }

    private WizardOutcome confirmAndPost(WizardSession session, DraftWager draft, UUID wagerId) {
        ledger.confirm(wagerId);
        draft.markConfirmAttempted();
        Wager wager = ledger.findById(wagerId).orElseThrow(() -> new WagerNotFoundException(wagerId));

        String artifactRef = draft.getPostedRef();
        if (artifactRef == null) {
            try {
                artifactRef = presenter.postArtifact(wager);
            } catch (PostFailureException e) {
                metrics.recordPostFailed();
                log.warn("Posting wager {} failed, left confirmed for retry: {}", wagerId, e.getMessage());
                return WizardOutcome.error(session.getId(), WizardOutcome.POST_FAILED,
                        "Your wager is saved but could not be posted. Select confirm to try posting it again.",
                        session.getCurrentPrompt());
            }
            draft.posted(artifactRef);
        } else {
            log.info("Wager {} was already posted as {}, recording it without posting again", wagerId, artifactRef);
        }

        postingService.recordPosted(wagerId, artifactRef);
        session.markConfirmed();
        close(session, "confirmed");
        metrics.recordWagerPosted(wager.getType().name());
        return WizardOutcome.confirmed(session.getId(), wagerId, artifactRef);
    }

    private void discardUnconfirmedWager(WizardSession session) {
        DraftWager draft = session.getDraft();
        if (draft.getWagerId() == null) {
            return;
        }
        if (draft.isConfirmAttempted()) {
            log.info("Keeping confirmed wager {} from closed session {}", draft.getWagerId(), session.getId());
            return;
        }
        try {
            ledger.delete(draft.getWagerId());
        } catch (IllegalStateException e) {
            log.warn("Could not discard wager {} for session {}: {}",
                    draft.getWagerId(), session.getId(), e.getMessage());
        }
    }

    private void close(WizardSession session, String outcome) {
        sessions.remove(session.getId());
        metrics.recordSessionClosed(outcome);
    }

    private WizardOutcome reject(WizardSession session, String code, String message) {
        metrics.recordInputRejected(session.getStep().name(), code);
        log.info("Rejected input for session {} at {}: {}", session.getId(), session.getStep(), message);
        return WizardOutcome.error(session.getId(), code, message, session.getCurrentPrompt());
    }

    // ==================== Ledger hand-off ====================

    private void persistDraft(WizardSession session) {
        DraftWager draft = session.getDraft();
        if (draft.getWagerId() == null) {
            UUID wagerId = ledger.create(draft.toWagerDraft(session.getOwnerId(), session.getGroupId()));
            draft.allocated(wagerId);
            log.info("Allocated wager {} for session {}", wagerId, session.getId());
        } else {
            ledger.updateStakeAndDestination(draft.getWagerId(), draft.getStake(), draft.getDestination());
        }
    }

    // ==================== Prompts ====================

    private StepPrompt buildPrompt(WizardSession session) {
        DraftWager draft = session.getDraft();
        StepPrompt.StepPromptBuilder prompt = StepPrompt.builder().step(session.getStep());

        switch (session.getStep()) {
            case SELECT_LINE_TYPE -> {
                prompt.title(draft.legCount() == 0 ? "Select line type" : "Select line type for leg " + (draft.legCount() + 1));
                for (LineType type : LineType.values()) {
                    prompt.option(new StepPrompt.Option(type.getCode(), type.getLabel()));
                }
            }
            case SELECT_LEAGUE -> {
                prompt.title("Select league");
                for (String league : settings.getLeagues()) {
                    prompt.option(new StepPrompt.Option(league, league));
                }
                prompt.option(new StepPrompt.Option(WizardSession.OTHER_LEAGUE, "Other"));
            }
            case SELECT_EVENT -> {
                List<ScheduledEvent> events = eventData.listUpcomingEvents(draft.getLeague());
                if (events.isEmpty()) {
                    log.debug("No scheduled {} events, falling through to manual entry", draft.getLeague());
                    session.fallThroughToLegDetails();
                    return buildPrompt(session);
                }
                session.offerEvents(events);
                prompt.title("Select game");
                for (ScheduledEvent event : events) {
                    prompt.option(new StepPrompt.Option(event.getEventRef(), event.label()));
                }
                prompt.option(new StepPrompt.Option(WizardSession.MANUAL_EVENT, "Other (Manual Entry)"));
            }
            case SELECT_PARTICIPANT -> {
                ScheduledEvent event = draft.getEvent();
                EventParticipants participants = eventData.listParticipants(event.getEventRef());
                if (participants.isEmpty()) {
                    log.debug("No participants for event {}, falling through to free text", event.getEventRef());
                    session.fallThroughToLegDetails();
                    return buildPrompt(session);
                }
                prompt.title("Select player");
                for (String participant : participants.getSideA()) {
                    prompt.option(new StepPrompt.Option(participant, participant + " (" + event.getHomeTeam() + ")"));
                }
                for (String participant : participants.getSideB()) {
                    prompt.option(new StepPrompt.Option(participant, participant + " (" + event.getAwayTeam() + ")"));
                }
            }
            case ENTER_LEG_DETAILS -> prompt
                    .title(draft.getEvent() == null ? "Enter bet details" : "Enter bet details for " + draft.getEvent().label())
                    .formFields(session.legFormFields());
            case LEG_DECISION -> {
                prompt.title("Leg " + draft.legCount() + " added");
                prompt.option(new StepPrompt.Option(WizardSession.ADD_LEG, "Add another leg"));
                if (draft.canFinalize()) {
                    prompt.option(new StepPrompt.Option(WizardSession.FINALIZE, "Finalize parlay"));
                }
            }
            case SELECT_STAKE -> {
                prompt.title("Select units");
                for (BigDecimal stake : stakePolicy.allowedStakes()) {
                    String plain = stake.stripTrailingZeros().toPlainString();
                    prompt.option(new StepPrompt.Option(plain, plain + (stake.compareTo(BigDecimal.ONE) == 0 ? " unit" : " units")));
                }
            }
            case SELECT_DESTINATION -> {
                prompt.title("Select channel to post in");
                for (Destination destination : presenter.listDestinations(session.getGroupId())) {
                    prompt.option(new StepPrompt.Option(destination.getId(), destination.getName()));
                }
            }
            case REVIEW_AND_CONFIRM -> prompt
                    .title("Review your wager")
                    .option(new StepPrompt.Option(WizardSession.CONFIRM, "Confirm and post"))
                    .option(new StepPrompt.Option(WizardSession.EDIT_STAKE, "Change units"))
                    .option(new StepPrompt.Option(WizardSession.EDIT_DESTINATION, "Change channel"));
            default -> throw new IllegalStateException("No prompt for terminal step " + session.getStep());
        }

        if (draft.legCount() > 0) {
            prompt.preview(draft.preview());
        }
        return prompt.build();
    }
}
