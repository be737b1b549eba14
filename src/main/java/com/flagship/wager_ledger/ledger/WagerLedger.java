package com.flagship.wager_ledger.ledger;

import com.flagship.wager_ledger.wager.Wager;
import com.flagship.wager_ledger.wager.WagerDraft;
import com.flagship.wager_ledger.wager.WagerStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage for wagers and their settlement records.
 *
 * Implementations must make confirm, post, settle and reverse atomic per wager.
 * Settlement and reversal are compare-and-swap operations on the wager's status: they
 * report whether this caller performed the transition instead of throwing when another
 * caller got there first.
 */
public interface WagerLedger {

    /**
     * Writes a new wager in CONFIRMED status under a freshly allocated id.
     */
    UUID create(WagerDraft draft);

    /**
     * Stamps the user's final confirmation on a CONFIRMED wager.
     *
     * @throws WagerNotFoundException if no wager has this id
     */
    void confirm(UUID wagerId);

    /**
     * @throws WagerNotFoundException if no wager has this id
     * @throws IllegalStateException if the wager is no longer CONFIRMED
     */
    void updateStakeAndDestination(UUID wagerId, BigDecimal stake, String destination);

    /**
     * CONFIRMED → POSTED with the artifact reference attached.
     *
     * @throws WagerNotFoundException if no wager has this id
     * @throws IllegalStateException if the wager is not CONFIRMED
     */
    void markPosted(UUID wagerId, String artifactRef);

    Optional<Wager> findById(UUID wagerId);

    Optional<Wager> findByArtifactRef(String artifactRef);

    /**
     * POSTED → settledStatus, writing the record in the same unit of work.
     *
     * @param record the record to write, or null for a transition that moves no units
     * @return false if the wager was not POSTED when the update ran
     */
    boolean recordSettlement(UUID wagerId, WagerStatus settledStatus, SettlementRecord record);

    /**
     * expectedStatus → POSTED, deleting the wager's settlement records.
     *
     * @return false if the wager was not in expectedStatus when the update ran
     */
    boolean reverseSettlement(UUID wagerId, WagerStatus expectedStatus);

    /**
     * Removes a wager that was never posted.
     *
     * @throws IllegalStateException if the wager has already been posted
     */
    void delete(UUID wagerId);

    List<SettlementRecord> findSettlementRecords(UUID wagerId);

    List<SettlementAuditEntry> findSettlementAudit(UUID wagerId);

    /**
     * Net units for an owner within a group over records created in [from, to).
     */
    BigDecimal sumResultValue(String ownerId, String groupId, Instant from, Instant to);
}
