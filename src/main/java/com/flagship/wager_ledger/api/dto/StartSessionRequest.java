package com.flagship.wager_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wager_ledger.wager.WagerType;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class StartSessionRequest {

    @NotBlank(message = "Owner ID is required")
    @JsonProperty("owner_id")
    String ownerId;

    @NotBlank(message = "Group ID is required")
    @JsonProperty("group_id")
    String groupId;

    /**
     * Defaults to STRAIGHT when omitted.
     */
    @JsonProperty("wager_type")
    WagerType wagerType;
}
