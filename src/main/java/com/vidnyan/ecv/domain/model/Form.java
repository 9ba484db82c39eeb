package com.vidnyan.ecv.domain.model;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A case-report form with an ordered list of fields.
 */
public record Form(
    String name,
    String label,
    List<Field> fields
) {

    public Form {
        Objects.requireNonNull(name, "form name");
        label = label == null ? name : label;
        fields = fields == null ? List.of() : List.copyOf(fields);

        Set<String> seen = new HashSet<>();
        for (Field field : fields) {
            if (!seen.add(field.name())) {
                throw new IllegalArgumentException(
                        "Duplicate field '" + field.name() + "' in form '" + name + "'");
            }
        }
    }

    public static Form of(String name, Field... fields) {
        return new Form(name, name, List.of(fields));
    }

    public Optional<Field> field(String fieldName) {
        return fields.stream()
                .filter(f -> f.name().equals(fieldName))
                .findFirst();
    }

    public int indexOf(String fieldName) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).name().equals(fieldName)) {
                return i;
            }
        }
        return -1;
    }
}
