package com.vidnyan.ecv.domain.model;

import lombok.Builder;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * An edit-check rule.
 * Immutable; the formalization stage derives a copy via {@link #withFormalizedCondition(String)}.
 */
@Builder(toBuilder = true)
public record Rule(
    String id,
    String condition,
    String formalizedCondition,
    String message,
    Severity severity,
    List<String> forms,
    List<String> fields
) {

    public Rule {
        Objects.requireNonNull(id, "rule id");
        condition = condition == null ? "" : condition;
        message = message == null ? "" : message;
        severity = severity == null ? Severity.ERROR : severity;
        forms = forms == null ? List.of() : List.copyOf(forms);
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    /**
     * Rule with only a formalized condition, as used by most callers and tests.
     */
    public static Rule formalized(String id, String formalizedCondition) {
        return Rule.builder().id(id).formalizedCondition(formalizedCondition).build();
    }

    public boolean hasFormalizedCondition() {
        return formalizedCondition != null && !formalizedCondition.isBlank();
    }

    /**
     * The formalized condition when present, otherwise the free-text condition.
     */
    public String effectiveCondition() {
        return hasFormalizedCondition() ? formalizedCondition : condition;
    }

    public Rule withFormalizedCondition(String formalized) {
        return toBuilder().formalizedCondition(formalized).build();
    }

    public enum Severity {
        ERROR, WARNING, INFO;

        public static Severity fromString(String value) {
            if (value == null) {
                return ERROR;
            }
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "warning", "warn" -> WARNING;
                case "info", "information" -> INFO;
                default -> ERROR;
            };
        }
    }
}
