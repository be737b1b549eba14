package com.flagship.wager_ledger.wager;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * JPA entity for wager rows.
 *
 * No setters: only stake/destination (before posting), confirmation time and the posted
 * reference change through the controlled methods below. Status changes after posting go
 * through conditional updates in {@link WagerRepository} so they behave as compare-and-swap.
 */
@Entity
@Table(
    name = "wagers",
    indexes = {
        @Index(name = "idx_wagers_posted_message_ref", columnList = "posted_message_ref"),
        @Index(name = "idx_wagers_owner_group", columnList = "owner_id, group_id"),
        @Index(name = "idx_wagers_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WagerEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "owner_id", nullable = false, updatable = false, length = 64)
    private String ownerId;

    @Column(name = "group_id", nullable = false, updatable = false, length = 64)
    private String groupId;

    @Enumerated(EnumType.STRING)
    @Column(name = "wager_type", nullable = false, updatable = false, length = 16)
    private WagerType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private WagerStatus status;

    @Column(nullable = false, precision = 10, scale = 4)
    private BigDecimal stake;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal price;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "wager_legs", joinColumns = @JoinColumn(name = "wager_id"))
    @OrderColumn(name = "leg_index")
    private List<LegEmbeddable> legs = new ArrayList<>();

    @Column(nullable = false, length = 64)
    private String destination;

    @Column(name = "posted_message_ref", unique = true, length = 128)
    private String postedMessageRef;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "confirmed_at")
    private Instant confirmedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static WagerEntity fromDomain(Wager wager) {
        return new WagerEntity(
            wager.getId(),
            wager.getOwnerId(),
            wager.getGroupId(),
            wager.getType(),
            wager.getStatus(),
            wager.getStake(),
            wager.getPrice(),
            wager.getLegs().stream().map(LegEmbeddable::fromDomain).collect(Collectors.toCollection(ArrayList::new)),
            wager.getDestination(),
            wager.getPostedMessageRef(),
            wager.getCreatedAt(),
            wager.getConfirmedAt(),
            wager.getUpdatedAt()
        );
    }

    public Wager toDomain() {
        return Wager.builder()
            .id(id)
            .ownerId(ownerId)
            .groupId(groupId)
            .type(type)
            .status(status)
            .stake(stake)
            .price(price)
            .legs(legs.stream().map(LegEmbeddable::toDomain).toList())
            .destination(destination)
            .postedMessageRef(postedMessageRef)
            .createdAt(createdAt)
            .confirmedAt(confirmedAt)
            .updatedAt(updatedAt)
            .build();
    }

    /**
     * Copies the fields that may change before posting. Legs, price, status and ids stay fixed.
     * Timestamps come from the domain object, which takes them from the ledger's clock.
     */
    public void applyEdit(Wager wager) {
        if (this.status != WagerStatus.CONFIRMED) {
            throw new IllegalStateException(
                "Wager " + id + " is " + status + "; only CONFIRMED wagers can be edited");
        }
        this.stake = wager.getStake();
        this.destination = wager.getDestination();
        this.confirmedAt = wager.getConfirmedAt();
        this.updatedAt = wager.getUpdatedAt();
    }
}
