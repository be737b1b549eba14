package com.flagship.wager_ledger.ledger;

import com.flagship.wager_ledger.wager.Wager;
import com.flagship.wager_ledger.wager.WagerDraft;
import com.flagship.wager_ledger.wager.WagerEntity;
import com.flagship.wager_ledger.wager.WagerRepository;
import com.flagship.wager_ledger.wager.WagerStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Relational ledger: wager rows through JPA, settlement records and the audit trail
 * through JDBC.
 *
 * Settle and reverse are a conditional status UPDATE followed by the record write in the
 * same transaction. Two racing signals for one wager both issue the UPDATE; the row lock
 * makes the second wait, and it then sees the new status and updates zero rows.
 */
@Service
@ConditionalOnProperty(name = "ledger.store", havingValue = "jpa", matchIfMissing = true)
@Slf4j
public class JpaWagerLedger implements WagerLedger {

    private final WagerRepository wagerRepository;
    private final JdbcTemplate jdbcTemplate;
    private final ArtifactRefIndex artifactRefIndex;
    private final Clock clock;

    public JpaWagerLedger(WagerRepository wagerRepository,
                          JdbcTemplate jdbcTemplate,
                          ArtifactRefIndex artifactRefIndex,
                          Clock clock) {
        this.wagerRepository = wagerRepository;
        this.jdbcTemplate = jdbcTemplate;
        this.artifactRefIndex = artifactRefIndex;
        this.clock = clock;
    }

    @Override
    @Transactional
    public UUID create(WagerDraft draft) {
        Wager wager = Wager.fromDraft(UUID.randomUUID(), draft, clock.instant());
        WagerEntity saved = wagerRepository.save(WagerEntity.fromDomain(wager));
        log.debug("Created wager {} for owner {}", saved.getId(), draft.getOwnerId());
        return saved.getId();
    }

    @Override
    @Transactional
    public void confirm(UUID wagerId) {
        WagerEntity entity = requireEntity(wagerId);
        entity.applyEdit(entity.toDomain().confirm(clock.instant()));
        wagerRepository.save(entity);
    }

    @Override
    @Transactional
    public void updateStakeAndDestination(UUID wagerId, BigDecimal stake, String destination) {
        WagerEntity entity = requireEntity(wagerId);
        entity.applyEdit(entity.toDomain().withStakeAndDestination(stake, destination, clock.instant()));
        wagerRepository.save(entity);
    }

    @Override
    @Transactional
    public void markPosted(UUID wagerId, String artifactRef) {
        if (artifactRef == null || artifactRef.isBlank()) {
            throw new IllegalArgumentException("Artifact reference is required to post wager " + wagerId);
        }
        int updated = wagerRepository.markPosted(wagerId, artifactRef, clock.instant());
        if (updated == 0) {
            WagerEntity entity = requireEntity(wagerId);
            throw new IllegalStateException(String.format(
                    "Cannot post wager %s in %s status. Wager must be CONFIRMED.", wagerId, entity.getStatus()));
        }
        artifactRefIndex.store(artifactRef, wagerId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Wager> findById(UUID wagerId) {
        return wagerRepository.findById(wagerId).map(WagerEntity::toDomain);
    }

    /**
     * Redis first, then the posted_message_ref index. A cached id whose row no longer
     * carries this ref is ignored.
     */
    @Override
    @Transactional(readOnly = true)
    public Optional<Wager> findByArtifactRef(String artifactRef) {
        Optional<Wager> cached = artifactRefIndex.lookup(artifactRef)
                .flatMap(wagerRepository::findById)
                .map(WagerEntity::toDomain)
                .filter(w -> artifactRef.equals(w.getPostedMessageRef()));
        if (cached.isPresent()) {
            return cached;
        }
        Optional<Wager> found = wagerRepository.findByPostedMessageRef(artifactRef).map(WagerEntity::toDomain);
        found.ifPresent(w -> artifactRefIndex.store(artifactRef, w.getId()));
        return found;
    }

    @Override
    @Transactional
    public boolean recordSettlement(UUID wagerId, WagerStatus settledStatus, SettlementRecord record) {
        if (!settledStatus.isSettled()) {
            throw new IllegalArgumentException("Not a settled status: " + settledStatus);
        }
        Instant now = clock.instant();
        int updated = wagerRepository.transitionStatus(wagerId, WagerStatus.POSTED, settledStatus, now);
        if (updated == 0) {
            return false;
        }

        if (record != null) {
            jdbcTemplate.update(
                "INSERT INTO settlement_records (id, wager_id, settled_status, stake_applied, price_applied, " +
                "result_value, created_at) VALUES (?, ?, ?, ?, ?, ?, ?)",
                record.getId(),
                wagerId,
                settledStatus.name(),
                record.getStakeApplied(),
                record.getPriceApplied(),
                record.getResultValue(),
                Timestamp.from(record.getCreatedAt())
            );
        }
        insertAudit(wagerId, SettlementAuditEntry.Action.SETTLED, settledStatus,
                record == null ? null : record.getResultValue(), now);
        return true;
    }

    @Override
    @Transactional
    public boolean reverseSettlement(UUID wagerId, WagerStatus expectedStatus) {
        if (!expectedStatus.isSettled()) {
            return false;
        }
        Instant now = clock.instant();
        int updated = wagerRepository.transitionStatus(wagerId, expectedStatus, WagerStatus.POSTED, now);
        if (updated == 0) {
            return false;
        }

        List<SettlementRecord> removed = findSettlementRecords(wagerId);
        jdbcTemplate.update("DELETE FROM settlement_records WHERE wager_id = ?", wagerId);
        if (removed.isEmpty()) {
            insertAudit(wagerId, SettlementAuditEntry.Action.REVERSED, expectedStatus, null, now);
        }
        for (SettlementRecord r : removed) {
            insertAudit(wagerId, SettlementAuditEntry.Action.REVERSED, expectedStatus, r.getResultValue(), now);
        }
        return true;
    }

    @Override
    @Transactional
    public void delete(UUID wagerId) {
        Optional<WagerEntity> existing = wagerRepository.findById(wagerId);
        if (existing.isEmpty()) {
            return;
        }
        WagerEntity entity = existing.get();
        if (entity.getPostedMessageRef() != null || entity.getStatus() != WagerStatus.CONFIRMED) {
            throw new IllegalStateException("Cannot delete wager " + wagerId + " in " + entity.getStatus() + " status");
        }
        wagerRepository.delete(entity);
        log.debug("Deleted unposted wager {}", wagerId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<SettlementRecord> findSettlementRecords(UUID wagerId) {
        return jdbcTemplate.query(
            "SELECT id, wager_id, settled_status, stake_applied, price_applied, result_value, created_at " +
            "FROM settlement_records WHERE wager_id = ? ORDER BY created_at",
            settlementRecordRowMapper(),
            wagerId
        );
    }

    @Override
    @Transactional(readOnly = true)
    public List<SettlementAuditEntry> findSettlementAudit(UUID wagerId) {
        return jdbcTemplate.query(
            "SELECT wager_id, action, settled_status, result_value, occurred_at, sequence_number " +
            "FROM settlement_audit WHERE wager_id = ? ORDER BY sequence_number",
            auditRowMapper(),
            wagerId
        );
    }

    @Override
    @Transactional(readOnly = true)
    public BigDecimal sumResultValue(String ownerId, String groupId, Instant from, Instant to) {
        BigDecimal total = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(r.result_value), 0) FROM settlement_records r " +
            "JOIN wagers w ON w.id = r.wager_id " +
            "WHERE w.owner_id = ? AND w.group_id = ? AND r.created_at >= ? AND r.created_at < ?",
            BigDecimal.class,
            ownerId,
            groupId,
            Timestamp.from(from),
            Timestamp.from(to)
        );
        return total != null ? total : BigDecimal.ZERO;
    }

    private void insertAudit(UUID wagerId, SettlementAuditEntry.Action action, WagerStatus status,
                             BigDecimal resultValue, Instant now) {
        jdbcTemplate.update(
            "INSERT INTO settlement_audit (id, wager_id, action, settled_status, result_value, occurred_at) " +
            "VALUES (?, ?, ?, ?, ?, ?)",
            UUID.randomUUID(),
            wagerId,
            action.name(),
            status.name(),
            resultValue,
            Timestamp.from(now)
        );
    }

    private WagerEntity requireEntity(UUID wagerId) {
        return wagerRepository.findById(wagerId)
                .orElseThrow(() -> new WagerNotFoundException(wagerId));
    }

    private RowMapper<SettlementRecord> settlementRecordRowMapper() {
        return (rs, rowNum) -> new SettlementRecord(
            rs.getObject("id", UUID.class),
            rs.getObject("wager_id", UUID.class),
            WagerStatus.valueOf(rs.getString("settled_status")),
            rs.getBigDecimal("stake_applied"),
            rs.getBigDecimal("price_applied"),
            rs.getBigDecimal("result_value"),
            rs.getTimestamp("created_at").toInstant()
        );
    }

    private RowMapper<SettlementAuditEntry> auditRowMapper() {
        return (rs, rowNum) -> new SettlementAuditEntry(
            rs.getObject("wager_id", UUID.class),
            SettlementAuditEntry.Action.valueOf(rs.getString("action")),
            WagerStatus.valueOf(rs.getString("settled_status")),
            rs.getBigDecimal("result_value"),
            rs.getTimestamp("occurred_at").toInstant(),
            rs.getLong("sequence_number")
        );
    }
}
