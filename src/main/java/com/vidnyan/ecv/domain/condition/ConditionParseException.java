package com.vidnyan.ecv.domain.condition;

/**
 * Thrown by {@link ConditionParser#parseStrict(String)} when a condition is not in the grammar.
 */
public class ConditionParseException extends RuntimeException {

    private final int position;

    public ConditionParseException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
