package com.flagship.wager_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
public class NetUnitsResponse {

    @JsonProperty("owner_id")
    String ownerId;

    @JsonProperty("group_id")
    String groupId;

    @JsonProperty("from")
    Instant from;

    @JsonProperty("to")
    Instant to;

    @JsonProperty("net_units")
    BigDecimal netUnits;
}
