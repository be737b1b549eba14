package com.flagship.wager_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wager_ledger.wizard.StepPrompt;
import com.flagship.wager_ledger.wizard.WizardOutcome;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WizardOutcomeResponse {

    @JsonProperty("session_id")
    UUID sessionId;

    @JsonProperty("kind")
    WizardOutcome.Kind kind;

    @JsonProperty("prompt")
    StepPrompt prompt;

    @JsonProperty("wager_id")
    UUID wagerId;

    @JsonProperty("artifact_ref")
    String artifactRef;

    @JsonProperty("error_code")
    String errorCode;

    @JsonProperty("message")
    String message;

    public static WizardOutcomeResponse from(WizardOutcome outcome) {
        return WizardOutcomeResponse.builder()
            .sessionId(outcome.getSessionId())
            .kind(outcome.getKind())
            .prompt(outcome.getPrompt())
            .wagerId(outcome.getWagerId())
            .artifactRef(outcome.getArtifactRef())
            .errorCode(outcome.getErrorCode())
            .message(outcome.getMessage())
            .build();
    }
}
