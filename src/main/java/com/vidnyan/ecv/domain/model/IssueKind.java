package com.vidnyan.ecv.domain.model;

/**
 * Typed error and warning codes reported on a {@link ValidationResult}.
 */
public enum IssueKind {
    MISSING_CONDITION("missing_condition"),
    PARSING_ERROR("parsing_error"),
    INVALID_FORM("invalid_form"),
    INVALID_FIELD("invalid_field"),
    TYPE_MISMATCH("type_mismatch"),
    INVALID_CATEGORICAL_VALUE("invalid_categorical_value"),
    UNSATISFIABLE_RULE("unsatisfiable_rule"),
    TAUTOLOGY("tautology"),
    REDUNDANT_CONDITION("redundant_condition"),
    CONTRADICTORY_RULES("contradictory_rules"),
    IMPLIED_RULE("implied_rule"),
    NULL_VALUES_SATISFY_RULE("null_values_satisfy_rule"),
    SOLVER_UNKNOWN("solver_unknown"),
    VERIFICATION_ERROR("verification_error");

    private final String code;

    IssueKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
