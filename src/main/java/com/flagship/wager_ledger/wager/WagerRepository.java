package com.flagship.wager_ledger.wager;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for wager rows.
 *
 * Status changes after posting are conditional updates: the row only changes when it is
 * still in the expected status, and the returned row count tells the caller whether it won.
 */
@Repository
public interface WagerRepository extends JpaRepository<WagerEntity, UUID> {

    Optional<WagerEntity> findByPostedMessageRef(String postedMessageRef);

    /**
     * Moves a wager from one status to another if and only if it is still in {@code from}.
     *
     * @return 1 if the transition happened, 0 if another transition got there first
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE WagerEntity w
        SET w.status = :to, w.updatedAt = :now
        WHERE w.id = :id AND w.status = :from
        """)
    int transitionStatus(@Param("id") UUID id,
                         @Param("from") WagerStatus from,
                         @Param("to") WagerStatus to,
                         @Param("now") Instant now);

    /**
     * Attaches the artifact reference while moving CONFIRMED → POSTED.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE WagerEntity w
        SET w.status = com.flagship.wager_ledger.wager.WagerStatus.POSTED,
            w.postedMessageRef = :ref, w.updatedAt = :now
        WHERE w.id = :id AND w.status = com.flagship.wager_ledger.wager.WagerStatus.CONFIRMED
        """)
    int markPosted(@Param("id") UUID id, @Param("ref") String postedMessageRef, @Param("now") Instant now);
}
