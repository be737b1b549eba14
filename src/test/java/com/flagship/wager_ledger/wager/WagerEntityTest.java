package com.flagship.wager_ledger.wager;

import com.flagship.wager_ledger.support.WagerFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class WagerEntityTest {

    private static final Instant CREATED = Instant.parse("2024-09-08T16:00:00Z");

    @Test
    @DisplayName("Edits take their timestamps from the domain object")
    void editKeepsDomainTimestamps() {
        Wager wager = Wager.fromDraft(UUID.randomUUID(), WagerFixtures.straight("user-1", "guild-1", "1.0", -110), CREATED);
        WagerEntity entity = WagerEntity.fromDomain(wager);
        Instant edited = CREATED.plus(Duration.ofMinutes(3));
        Instant confirmed = CREATED.plus(Duration.ofMinutes(5));

        entity.applyEdit(wager.withStakeAndDestination(new BigDecimal("2.5"), "chan-parlays", edited));
        assertEquals(edited, entity.getUpdatedAt());

        entity.applyEdit(entity.toDomain().confirm(confirmed));

        Wager stored = entity.toDomain();
        assertEquals(CREATED, stored.getCreatedAt());
        assertEquals(confirmed, stored.getConfirmedAt());
        assertEquals(confirmed, stored.getUpdatedAt());
        assertEquals(0, new BigDecimal("2.5").compareTo(stored.getStake()));
        assertEquals("chan-parlays", stored.getDestination());
    }

    @Test
    @DisplayName("Only confirmed wagers can be edited")
    void postedWagerNotEditable() {
        Wager wager = Wager.fromDraft(UUID.randomUUID(), WagerFixtures.straight("user-1", "guild-1", "1.0", -110), CREATED);
        Wager posted = wager.markPosted("msg-1", CREATED.plusSeconds(30));
        WagerEntity entity = WagerEntity.fromDomain(posted);

        assertThrows(IllegalStateException.class, () -> entity.applyEdit(posted));
    }
}
