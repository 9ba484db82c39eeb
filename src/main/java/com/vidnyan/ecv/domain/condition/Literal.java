package com.vidnyan.ecv.domain.condition;

import java.math.BigDecimal;

/**
 * Constant operand of a comparison.
 */
public record Literal(Kind kind, Object value) implements Operand {

    public static final Literal NULL = new Literal(Kind.NULL, null);

    public enum Kind { NUMBER, STRING, BOOLEAN, NULL }

    public static Literal number(BigDecimal value) {
        return new Literal(Kind.NUMBER, value);
    }

    public static Literal number(double value) {
        return number(BigDecimal.valueOf(value));
    }

    public static Literal string(String value) {
        return new Literal(Kind.STRING, value);
    }

    public static Literal bool(boolean value) {
        return new Literal(Kind.BOOLEAN, value);
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    public boolean isNumber() {
        return kind == Kind.NUMBER;
    }

    public BigDecimal asNumber() {
        return (BigDecimal) value;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case NUMBER -> asNumber().toPlainString();
            case STRING -> "'" + value + "'";
            case BOOLEAN -> value.toString().toUpperCase();
            case NULL -> "NULL";
        };
    }
}
