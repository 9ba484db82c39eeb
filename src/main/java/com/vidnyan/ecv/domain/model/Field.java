package com.vidnyan.ecv.domain.model;

import lombok.Builder;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A field declared on a form.
 * Bounds are raw values as declared (a number for numeric fields, an ISO date for dates).
 */
@Builder(toBuilder = true)
public record Field(
    String name,
    FieldType type,
    String label,
    boolean required,
    List<String> validValues,
    String minValue,
    String maxValue
) {

    public Field {
        Objects.requireNonNull(name, "field name");
        type = type == null ? FieldType.TEXT : type;
        label = label == null ? name : label;
        validValues = validValues == null ? List.of() : List.copyOf(validValues);
    }

    public static Field of(String name, FieldType type) {
        return Field.builder().name(name).type(type).build();
    }

    public boolean hasValidValues() {
        return !validValues.isEmpty();
    }

    /**
     * Lower bound on the solver scale of this field's type, if declared and parseable.
     */
    public Optional<Double> lowerBound() {
        return FieldValues.toScale(type, minValue);
    }

    /**
     * Upper bound on the solver scale of this field's type, if declared and parseable.
     */
    public Optional<Double> upperBound() {
        return FieldValues.toScale(type, maxValue);
    }
}
