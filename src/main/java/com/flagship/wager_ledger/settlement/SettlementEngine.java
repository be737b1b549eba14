package com.flagship.wager_ledger.settlement;

import com.flagship.wager_ledger.ledger.SettlementRecord;
import com.flagship.wager_ledger.ledger.WagerLedger;
import com.flagship.wager_ledger.observability.CorrelationContext;
import com.flagship.wager_ledger.observability.WagerMetrics;
import com.flagship.wager_ledger.outbox.OutboxService;
import com.flagship.wager_ledger.wager.Wager;
import com.flagship.wager_ledger.wager.WagerStatus;
import com.flagship.wager_ledger.wager.event.WagerSettledEvent;
import com.flagship.wager_ledger.wager.event.WagerSettlementReversedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Applies and retracts outcome signals on posted wagers.
 *
 * The wager's status is the only state consulted:
 * - A signal is applied only to a POSTED wager, and moves it to the status the signal implies
 * - A retraction is applied only while the wager is in the status that signal implies
 * - Anything else (duplicates, crossed signals, retractions of signals never applied) is a no-op
 * - Signals from anyone but the placing user are ignored
 *
 * The ledger performs the status change as a compare-and-swap together with the record
 * write, so racing signals on one wager cannot both apply. The outbox event is written in
 * the same transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementEngine {

    private final WagerLedger ledger;
    private final OutboxService outboxService;
    private final WagerMetrics metrics;
    private final Clock clock;

    @Transactional
    public SettlementOutcome onOutcomeSignalAdded(String artifactRef, SignalKind kind, String actorId) {
        SettlementOutcome outcome = metrics.timeSettlement(() -> applySignal(artifactRef, kind, actorId));
        metrics.recordSignal("added", kind.name(), outcome.name());
        return outcome;
    }

    @Transactional
    public SettlementOutcome onOutcomeSignalRemoved(String artifactRef, SignalKind kind, String actorId) {
        SettlementOutcome outcome = metrics.timeSettlement(() -> retractSignal(artifactRef, kind, actorId));
        metrics.recordSignal("removed", kind.name(), outcome.name());
        return outcome;
    }

    /**
     * Net units won or lost by an owner in a group, over settlements recorded in [from, to).
     */
    @Transactional(readOnly = true)
    public BigDecimal netUnits(String ownerId, String groupId, Instant from, Instant to) {
        return ledger.sumResultValue(ownerId, groupId, from, to);
    }

    private SettlementOutcome applySignal(String artifactRef, SignalKind kind, String actorId) {
        Optional<Wager> found = ledger.findByArtifactRef(artifactRef);
        if (found.isEmpty()) {
            log.debug("No wager posted as {}, ignoring {} signal", artifactRef, kind);
            return SettlementOutcome.NOT_FOUND;
        }
        Wager wager = found.get();
        MDC.put(CorrelationContext.WAGER_ID_MDC_KEY, wager.getId().toString());
        try {
            if (!wager.getOwnerId().equals(actorId)) {
                log.debug("Ignoring {} signal on wager {} from non-owner {}", kind, wager.getId(), actorId);
                return SettlementOutcome.IGNORED_ACTOR;
            }
            if (wager.getStatus() != WagerStatus.POSTED) {
                log.debug("Wager {} is {}, ignoring {} signal", wager.getId(), wager.getStatus(), kind);
                return SettlementOutcome.STALE_STATE;
            }

            WagerStatus target = kind.getSettledStatus();
            Instant now = clock.instant();
            BigDecimal resultValue = wager.resultValueFor(target);
            SettlementRecord record = kind.writesRecord()
                    ? new SettlementRecord(UUID.randomUUID(), wager.getId(), target,
                            wager.getStake(), wager.getPrice(), resultValue, now)
                    : null;

            if (!ledger.recordSettlement(wager.getId(), target, record)) {
                log.debug("Wager {} left POSTED before {} could apply", wager.getId(), kind);
                return SettlementOutcome.STALE_STATE;
            }

            outboxService.saveEvent(WagerSettledEvent.fromWager(wager, target,
                    record == null ? null : resultValue, now));
            log.info("Wager {} settled {} ({} units)", wager.getId(), target,
                    record == null ? "no" : resultValue.toPlainString());
            return SettlementOutcome.APPLIED;
        } finally {
            MDC.remove(CorrelationContext.WAGER_ID_MDC_KEY);
        }
    }

    private SettlementOutcome retractSignal(String artifactRef, SignalKind kind, String actorId) {
        Optional<Wager> found = ledger.findByArtifactRef(artifactRef);
        if (found.isEmpty()) {
            log.debug("No wager posted as {}, ignoring {} retraction", artifactRef, kind);
            return SettlementOutcome.NOT_FOUND;
        }
        Wager wager = found.get();
        MDC.put(CorrelationContext.WAGER_ID_MDC_KEY, wager.getId().toString());
        try {
            if (!wager.getOwnerId().equals(actorId)) {
                log.debug("Ignoring {} retraction on wager {} from non-owner {}", kind, wager.getId(), actorId);
                return SettlementOutcome.IGNORED_ACTOR;
            }
            WagerStatus expected = kind.getSettledStatus();
            if (wager.getStatus() != expected) {
                log.debug("Wager {} is {}, not {}; ignoring {} retraction",
                        wager.getId(), wager.getStatus(), expected, kind);
                return SettlementOutcome.STALE_STATE;
            }

            if (!ledger.reverseSettlement(wager.getId(), expected)) {
                log.debug("Wager {} left {} before the {} retraction could apply", wager.getId(), expected, kind);
                return SettlementOutcome.STALE_STATE;
            }

            outboxService.saveEvent(WagerSettlementReversedEvent.fromWager(wager, expected, clock.instant()));
            log.info("Wager {} reverted from {} to POSTED", wager.getId(), expected);
            return SettlementOutcome.APPLIED;
        } finally {
            MDC.remove(CorrelationContext.WAGER_ID_MDC_KEY);
        }
    }
}
