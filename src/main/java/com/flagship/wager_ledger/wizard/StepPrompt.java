package com.flagship.wager_ledger.wizard;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * What the chat layer should render for the current step: a list of choices or a form,
 * plus an optional preview of the wager so far.
 */
@Value
@Builder
public class StepPrompt {
    WizardStep step;
    String title;
    @Singular
    List<Option> options;
    @Singular
    List<FormField> formFields;
    String preview;

    public boolean offers(String value) {
        return options.stream().anyMatch(o -> o.getValue().equals(value));
    }

    @Value
    public static class Option {
        String value;
        String label;
    }

    @Value
    public static class FormField {
        String name;
        String label;
        boolean required;
    }
}
