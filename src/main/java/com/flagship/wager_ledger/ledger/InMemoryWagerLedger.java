package com.flagship.wager_ledger.ledger;

import com.flagship.wager_ledger.wager.Wager;
import com.flagship.wager_ledger.wager.WagerDraft;
import com.flagship.wager_ledger.wager.WagerStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Process-local ledger used for tests and single-node development runs.
 *
 * Every method holds the instance monitor, which gives the per-row atomicity the engine
 * needs (and more). Nothing survives a restart.
 */
@Component
@ConditionalOnProperty(name = "ledger.store", havingValue = "memory")
@Slf4j
public class InMemoryWagerLedger implements WagerLedger {

    private final Clock clock;
    private final Map<UUID, Wager> wagers = new HashMap<>();
    private final Map<String, UUID> byArtifactRef = new HashMap<>();
    private final Map<UUID, List<SettlementRecord>> records = new HashMap<>();
    private final List<SettlementRecord> allRecords = new ArrayList<>();
    private final List<SettlementAuditEntry> audit = new ArrayList<>();
    private long auditSequence;

    public InMemoryWagerLedger(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized UUID create(WagerDraft draft) {
        UUID id = UUID.randomUUID();
        wagers.put(id, Wager.fromDraft(id, draft, clock.instant()));
        log.debug("Created wager {} for owner {}", id, draft.getOwnerId());
        return id;
    }

    @Override
    public synchronized void confirm(UUID wagerId) {
        wagers.put(wagerId, require(wagerId).confirm(clock.instant()));
    }

    @Override
    public synchronized void updateStakeAndDestination(UUID wagerId, BigDecimal stake, String destination) {
        wagers.put(wagerId, require(wagerId).withStakeAndDestination(stake, destination, clock.instant()));
    }

    @Override
    public synchronized void markPosted(UUID wagerId, String artifactRef) {
        if (byArtifactRef.containsKey(artifactRef)) {
            throw new IllegalStateException("Artifact ref already attached to a wager: " + artifactRef);
        }
        wagers.put(wagerId, require(wagerId).markPosted(artifactRef, clock.instant()));
        byArtifactRef.put(artifactRef, wagerId);
    }

    @Override
    public synchronized Optional<Wager> findById(UUID wagerId) {
        return Optional.ofNullable(wagers.get(wagerId));
    }

    @Override
    public synchronized Optional<Wager> findByArtifactRef(String artifactRef) {
        UUID id = byArtifactRef.get(artifactRef);
        return id == null ? Optional.empty() : Optional.ofNullable(wagers.get(id));
    }

    @Override
    public synchronized boolean recordSettlement(UUID wagerId, WagerStatus settledStatus, SettlementRecord record) {
        Wager wager = wagers.get(wagerId);
        if (wager == null || wager.getStatus() != WagerStatus.POSTED) {
            return false;
        }
        Instant now = clock.instant();
        wagers.put(wagerId, wager.settle(settledStatus, now));
        if (record != null) {
            records.computeIfAbsent(wagerId, k -> new ArrayList<>()).add(record);
            allRecords.add(record);
        }
        audit.add(new SettlementAuditEntry(wagerId, SettlementAuditEntry.Action.SETTLED, settledStatus,
                record == null ? null : record.getResultValue(), now, ++auditSequence));
        return true;
    }

    @Override
    public synchronized boolean reverseSettlement(UUID wagerId, WagerStatus expectedStatus) {
        Wager wager = wagers.get(wagerId);
        if (wager == null || wager.getStatus() != expectedStatus || !expectedStatus.isSettled()) {
            return false;
        }
        Instant now = clock.instant();
        wagers.put(wagerId, wager.revert(expectedStatus, now));
        List<SettlementRecord> removed = records.remove(wagerId);
        if (removed == null || removed.isEmpty()) {
            audit.add(new SettlementAuditEntry(wagerId, SettlementAuditEntry.Action.REVERSED, expectedStatus,
                    null, now, ++auditSequence));
        } else {
            allRecords.removeAll(removed);
            for (SettlementRecord r : removed) {
                audit.add(new SettlementAuditEntry(wagerId, SettlementAuditEntry.Action.REVERSED, expectedStatus,
                        r.getResultValue(), now, ++auditSequence));
            }
        }
        return true;
    }

    @Override
    public synchronized void delete(UUID wagerId) {
        Wager wager = wagers.get(wagerId);
        if (wager == null) {
            return;
        }
        if (wager.getPostedMessageRef() != null || wager.getStatus() != WagerStatus.CONFIRMED) {
            throw new IllegalStateException("Cannot delete wager " + wagerId + " in " + wager.getStatus() + " status");
        }
        wagers.remove(wagerId);
    }

    @Override
    public synchronized List<SettlementRecord> findSettlementRecords(UUID wagerId) {
        return List.copyOf(records.getOrDefault(wagerId, List.of()));
    }

    @Override
    public synchronized List<SettlementAuditEntry> findSettlementAudit(UUID wagerId) {
        return audit.stream().filter(e -> e.getWagerId().equals(wagerId)).toList();
    }

    @Override
    public synchronized BigDecimal sumResultValue(String ownerId, String groupId, Instant from, Instant to) {
        BigDecimal total = BigDecimal.ZERO;
        for (SettlementRecord record : allRecords) {
            Wager wager = wagers.get(record.getWagerId());
            if (wager == null
                    || !wager.getOwnerId().equals(ownerId)
                    || !wager.getGroupId().equals(groupId)
                    || record.getCreatedAt().isBefore(from)
                    || !record.getCreatedAt().isBefore(to)) {
                continue;
            }
            total = total.add(record.getResultValue());
        }
        return total;
    }

    private Wager require(UUID wagerId) {
        Wager wager = wagers.get(wagerId);
        if (wager == null) {
            throw new WagerNotFoundException(wagerId);
        }
        return wager;
    }
}
