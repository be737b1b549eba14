package com.flagship.wager_ledger.wager;

import com.flagship.wager_ledger.odds.OddsMath;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Wager domain object as held by the ledger.
 *
 * Status transitions are explicit and validated; each transition returns a new instance.
 * Legs are fixed once the wager is in the ledger.
 */
@Value
@Builder(toBuilder = true)
public class Wager {
    UUID id;
    String ownerId;
    String groupId;
    WagerType type;
    WagerStatus status;
    BigDecimal stake;
    BigDecimal price;
    List<Leg> legs;
    String destination;
    String postedMessageRef;
    Instant createdAt;
    Instant confirmedAt;
    Instant updatedAt;

    /**
     * Creates the ledger form of a draft under a freshly allocated id.
     */
    public static Wager fromDraft(UUID id, WagerDraft draft, Instant now) {
        return Wager.builder()
                .id(id)
                .ownerId(draft.getOwnerId())
                .groupId(draft.getGroupId())
                .type(draft.getType())
                .status(WagerStatus.CONFIRMED)
                .stake(draft.getStake())
                .price(draft.getPrice())
                .legs(List.copyOf(draft.getLegs()))
                .destination(draft.getDestination())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public long americanPrice() {
        return OddsMath.toAmerican(price);
    }

    /**
     * Units won (positive), lost (negative) or returned (zero) for the given settled status.
     */
    public BigDecimal resultValueFor(WagerStatus settledStatus) {
        return switch (settledStatus) {
            case SETTLED_WON -> stake.multiply(price.subtract(BigDecimal.ONE))
                    .setScale(OddsMath.PRICE_SCALE, RoundingMode.HALF_UP);
            case SETTLED_LOST -> stake.negate().setScale(OddsMath.PRICE_SCALE, RoundingMode.HALF_UP);
            case SETTLED_PUSH, VOIDED -> BigDecimal.ZERO.setScale(OddsMath.PRICE_SCALE);
            default -> throw new IllegalArgumentException("Not a settled status: " + settledStatus);
        };
    }

    /**
     * Records the user's final confirmation. Only valid while CONFIRMED and not yet posted.
     */
    public Wager confirm(Instant now) {
        requireStatus(WagerStatus.CONFIRMED, "confirm");
        return toBuilder().confirmedAt(now).updatedAt(now).build();
    }

    public Wager withStakeAndDestination(BigDecimal newStake, String newDestination, Instant now) {
        requireStatus(WagerStatus.CONFIRMED, "change stake or destination of");
        return toBuilder().stake(newStake).destination(newDestination).updatedAt(now).build();
    }

    /**
     * CONFIRMED → POSTED, attaching the reference of the posted artifact.
     */
    public Wager markPosted(String artifactRef, Instant now) {
        requireStatus(WagerStatus.CONFIRMED, "post");
        if (artifactRef == null || artifactRef.isBlank()) {
            throw new IllegalArgumentException("Artifact reference is required to post wager " + id);
        }
        return toBuilder().status(WagerStatus.POSTED).postedMessageRef(artifactRef).updatedAt(now).build();
    }

    /**
     * POSTED → one of the settled statuses.
     */
    public Wager settle(WagerStatus settledStatus, Instant now) {
        if (!settledStatus.isSettled()) {
            throw new IllegalArgumentException("Not a settled status: " + settledStatus);
        }
        requireStatus(WagerStatus.POSTED, "settle");
        return toBuilder().status(settledStatus).updatedAt(now).build();
    }

    /**
     * Settled → POSTED, only from the status being retracted.
     */
    public Wager revert(WagerStatus expectedStatus, Instant now) {
        requireStatus(expectedStatus, "revert");
        if (!expectedStatus.isSettled()) {
            throw new IllegalStateException("Wager " + id + " is not settled");
        }
        return toBuilder().status(WagerStatus.POSTED).updatedAt(now).build();
    }

    private void requireStatus(WagerStatus expected, String action) {
        if (this.status != expected) {
            throw new IllegalStateException(String.format(
                    "Cannot %s wager %s in %s status. Wager must be %s.", action, id, status, expected));
        }
    }
}
