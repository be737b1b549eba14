package com.flagship.wager_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wager_ledger.ledger.SettlementAuditEntry;
import com.flagship.wager_ledger.ledger.SettlementRecord;
import com.flagship.wager_ledger.wager.Leg;
import com.flagship.wager_ledger.wager.Wager;
import com.flagship.wager_ledger.wager.WagerStatus;
import com.flagship.wager_ledger.wager.WagerType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A wager with its current settlement records and full settlement history.
 */
@Value
@Builder
public class WagerResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("owner_id")
    String ownerId;

    @JsonProperty("group_id")
    String groupId;

    @JsonProperty("type")
    WagerType type;

    @JsonProperty("status")
    WagerStatus status;

    @JsonProperty("stake")
    BigDecimal stake;

    @JsonProperty("price")
    BigDecimal price;

    @JsonProperty("american_price")
    long americanPrice;

    @JsonProperty("legs")
    List<Leg> legs;

    @JsonProperty("destination")
    String destination;

    @JsonProperty("artifact_ref")
    String artifactRef;

    @JsonProperty("settlement_records")
    List<SettlementRecord> settlementRecords;

    @JsonProperty("settlement_audit")
    List<SettlementAuditEntry> settlementAudit;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static WagerResponse from(Wager wager, List<SettlementRecord> records, List<SettlementAuditEntry> audit) {
        return WagerResponse.builder()
            .id(wager.getId())
            .ownerId(wager.getOwnerId())
            .groupId(wager.getGroupId())
            .type(wager.getType())
            .status(wager.getStatus())
            .stake(wager.getStake())
            .price(wager.getPrice())
            .americanPrice(wager.americanPrice())
            .legs(wager.getLegs())
            .destination(wager.getDestination())
            .artifactRef(wager.getPostedMessageRef())
            .settlementRecords(records)
            .settlementAudit(audit)
            .createdAt(wager.getCreatedAt())
            .updatedAt(wager.getUpdatedAt())
            .build();
    }
}
