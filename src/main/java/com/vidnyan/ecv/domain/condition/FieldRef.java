package com.vidnyan.ecv.domain.condition;

import java.util.Objects;

/**
 * Reference to a field as {@code Form.Field}.
 */
public record FieldRef(String form, String field) implements Operand {

    public FieldRef {
        Objects.requireNonNull(form, "form");
        Objects.requireNonNull(field, "field");
    }

    /**
     * Parse {@code Form.Field}; the first dot separates form from field.
     */
    public static FieldRef parse(String path) {
        int dot = path.indexOf('.');
        if (dot <= 0 || dot == path.length() - 1) {
            throw new IllegalArgumentException("Not a Form.Field reference: " + path);
        }
        return new FieldRef(path.substring(0, dot), path.substring(dot + 1));
    }

    public String path() {
        return form + "." + field;
    }

    @Override
    public String toString() {
        return path();
    }
}
