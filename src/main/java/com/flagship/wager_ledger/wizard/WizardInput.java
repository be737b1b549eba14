package com.flagship.wager_ledger.wizard;

import lombok.Value;

import java.util.Map;

/**
 * One external input fed to a session: a selection from the offered options, a submitted
 * form, or a cancel request.
 */
@Value
public class WizardInput {

    public enum Kind {
        SELECT,
        FORM,
        CANCEL
    }

    Kind kind;
    String value;
    Map<String, String> fields;

    public static WizardInput select(String value) {
        return new WizardInput(Kind.SELECT, value, Map.of());
    }

    public static WizardInput form(Map<String, String> fields) {
        return new WizardInput(Kind.FORM, null, fields == null ? Map.of() : Map.copyOf(fields));
    }

    public static WizardInput cancel() {
        return new WizardInput(Kind.CANCEL, null, Map.of());
    }

    /**
     * Trimmed field value, or null when absent or blank.
     */
    public String field(String name) {
        String raw = fields.get(name);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return raw.trim();
    }
}
