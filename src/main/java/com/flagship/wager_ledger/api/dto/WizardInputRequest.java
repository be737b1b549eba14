package com.flagship.wager_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wager_ledger.wizard.WizardInput;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.Map;

/**
 * One selection, form submission or cancel, as sent by the chat layer.
 */
@Value
public class WizardInputRequest {

    @NotBlank(message = "Owner ID is required")
    @JsonProperty("owner_id")
    String ownerId;

    @NotNull(message = "Input kind is required")
    @JsonProperty("kind")
    WizardInput.Kind kind;

    @JsonProperty("value")
    String value;

    @JsonProperty("fields")
    Map<String, String> fields;

    public WizardInput toInput() {
        return switch (kind) {
            case SELECT -> {
                if (value == null || value.isBlank()) {
                    throw new IllegalArgumentException("A selection needs a value");
                }
                yield WizardInput.select(value);
            }
            case FORM -> WizardInput.form(fields);
            case CANCEL -> WizardInput.cancel();
        };
    }
}
