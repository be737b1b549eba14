package com.flagship.wager_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wager_ledger.settlement.SettlementOutcome;
import com.flagship.wager_ledger.settlement.SignalKind;
import lombok.Value;

@Value
public class SignalResponse {

    @JsonProperty("artifact_ref")
    String artifactRef;

    @JsonProperty("kind")
    SignalKind kind;

    @JsonProperty("outcome")
    SettlementOutcome outcome;
}
