package com.flagship.wager_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class SignalRequest {

    @NotBlank(message = "Artifact reference is required")
    @JsonProperty("artifact_ref")
    String artifactRef;

    @NotBlank(message = "Actor ID is required")
    @JsonProperty("actor_id")
    String actorId;

    @NotBlank(message = "Signal kind is required")
    @JsonProperty("kind")
    String kind;
}
