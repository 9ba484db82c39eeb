package com.vidnyan.ecv.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Outcome of verifying one rule.
 * Validity is derived: any error makes the rule invalid, warnings never do.
 * Created fresh per invocation and filled by a single thread.
 */
public final class ValidationResult {

    private final String ruleId;
    private final List<Issue> errors = new ArrayList<>();
    private final List<Issue> warnings = new ArrayList<>();

    public ValidationResult(String ruleId) {
        this.ruleId = ruleId;
    }

    public String ruleId() {
        return ruleId;
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<Issue> errors() {
        return Collections.unmodifiableList(errors);
    }

    public List<Issue> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    public ValidationResult addError(IssueKind kind, String message) {
        return addError(kind, message, Map.of());
    }

    public ValidationResult addError(IssueKind kind, String message, Map<String, Object> details) {
        errors.add(new Issue(kind, message, details));
        return this;
    }

    public ValidationResult addWarning(IssueKind kind, String message) {
        return addWarning(kind, message, Map.of());
    }

    public ValidationResult addWarning(IssueKind kind, String message, Map<String, Object> details) {
        warnings.add(new Issue(kind, message, details));
        return this;
    }

    public boolean hasError(IssueKind kind) {
        return errors.stream().anyMatch(i -> i.kind() == kind);
    }

    public boolean hasWarning(IssueKind kind) {
        return warnings.stream().anyMatch(i -> i.kind() == kind);
    }

    @Override
    public String toString() {
        return "ValidationResult{" + ruleId + ", valid=" + isValid()
                + ", errors=" + errors + ", warnings=" + warnings + "}";
    }

    /**
     * A typed error or warning.
     */
    public record Issue(IssueKind kind, String message, Map<String, Object> details) {

        public Issue {
            details = details == null ? Map.of() : Map.copyOf(details);
        }

        public String code() {
            return kind.code();
        }
    }
}
