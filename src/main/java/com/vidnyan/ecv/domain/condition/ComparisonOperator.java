package com.vidnyan.ecv.domain.condition;

import java.util.Optional;

/**
 * The six comparison operators of the condition language.
 */
public enum ComparisonOperator {
    EQ("="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Accepts the canonical symbols plus the {@code ==} and {@code <>} aliases.
     */
    public static Optional<ComparisonOperator> fromSymbol(String symbol) {
        return Optional.ofNullable(switch (symbol.trim()) {
            case "=", "==" -> EQ;
            case "!=", "<>" -> NE;
            case "<" -> LT;
            case "<=" -> LE;
            case ">" -> GT;
            case ">=" -> GE;
            default -> null;
        });
    }

    /**
     * Operator with the operands swapped: {@code a > b} iff {@code b < a}.
     */
    public ComparisonOperator converse() {
        return switch (this) {
            case LT -> GT;
            case LE -> GE;
            case GT -> LT;
            case GE -> LE;
            default -> this;
        };
    }

    /**
     * Logical complement: {@code !(a > b)} iff {@code a <= b}.
     */
    public ComparisonOperator negate() {
        return switch (this) {
            case EQ -> NE;
            case NE -> EQ;
            case LT -> GE;
            case LE -> GT;
            case GT -> LE;
            case GE -> LT;
        };
    }

    public boolean isOrdering() {
        return this != EQ && this != NE;
    }

    /**
     * Apply to a {@code compareTo} result.
     */
    public boolean test(int comparison) {
        return switch (this) {
            case EQ -> comparison == 0;
            case NE -> comparison != 0;
            case LT -> comparison < 0;
            case LE -> comparison <= 0;
            case GT -> comparison > 0;
            case GE -> comparison >= 0;
        };
    }

    public boolean test(double left, double right) {
        return test(Double.compare(left, right));
    }

    @Override
    public String toString() {
        return symbol;
    }
}
