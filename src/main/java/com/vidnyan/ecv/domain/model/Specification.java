package com.vidnyan.ecv.domain.model;

import com.vidnyan.ecv.domain.condition.FieldRef;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Study specification: the forms of a study and their fields.
 * Immutable; form order is preserved.
 */
public final class Specification {

    private final Map<String, Form> forms;
    private final List<String> formOrder;

    private Specification(Map<String, Form> forms) {
        this.forms = Collections.unmodifiableMap(forms);
        this.formOrder = List.copyOf(forms.keySet());
    }

    /**
     * Build a specification, rejecting duplicate form names.
     */
    public static Specification of(List<Form> forms) {
        Map<String, Form> byName = new LinkedHashMap<>();
        for (Form form : forms) {
            if (byName.putIfAbsent(form.name(), form) != null) {
                throw new IllegalArgumentException("Duplicate form '" + form.name() + "'");
            }
        }
        return new Specification(byName);
    }

    public static Specification of(Form... forms) {
        return of(List.of(forms));
    }

    public Map<String, Form> forms() {
        return forms;
    }

    public Optional<Form> form(String name) {
        return Optional.ofNullable(forms.get(name));
    }

    public boolean hasForm(String name) {
        return forms.containsKey(name);
    }

    public Optional<Field> field(String formName, String fieldName) {
        return form(formName).flatMap(f -> f.field(fieldName));
    }

    public Optional<Field> field(FieldRef ref) {
        return field(ref.form(), ref.field());
    }

    /**
     * Global declaration position of a field (form order, then field order).
     * Undeclared fields sort last.
     */
    public int declarationIndex(FieldRef ref) {
        int offset = 0;
        for (String name : formOrder) {
            Form form = forms.get(name);
            if (name.equals(ref.form())) {
                int idx = form.indexOf(ref.field());
                return idx < 0 ? Integer.MAX_VALUE : offset + idx;
            }
            offset += form.fields().size();
        }
        return Integer.MAX_VALUE;
    }
}
