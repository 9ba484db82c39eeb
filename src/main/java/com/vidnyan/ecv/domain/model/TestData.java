package com.vidnyan.ecv.domain.model;

import com.vidnyan.ecv.domain.condition.FieldRef;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable, task-local builder for test data ({@code form -> field -> value}).
 */
public final class TestData {

    private final Map<String, Map<String, Object>> values = new LinkedHashMap<>();

    public static TestData empty() {
        return new TestData();
    }

    public static TestData from(Map<String, Map<String, Object>> source) {
        TestData data = new TestData();
        source.forEach((form, fields) -> data.values.put(form, new LinkedHashMap<>(fields)));
        return data;
    }

    public TestData put(FieldRef ref, Object value) {
        values.computeIfAbsent(ref.form(), k -> new LinkedHashMap<>()).put(ref.field(), value);
        return this;
    }

    /**
     * Remove a field but keep its form present, so the value reads as missing.
     */
    public TestData remove(FieldRef ref) {
        values.computeIfAbsent(ref.form(), k -> new LinkedHashMap<>()).remove(ref.field());
        return this;
    }

    public Optional<Object> get(FieldRef ref) {
        Map<String, Object> fields = values.get(ref.form());
        return fields == null ? Optional.empty() : Optional.ofNullable(fields.get(ref.field()));
    }

    public TestData copy() {
        return from(values);
    }

    /**
     * Immutable snapshot.
     */
    public Map<String, Map<String, Object>> toMap() {
        Map<String, Map<String, Object>> snapshot = new LinkedHashMap<>();
        values.forEach((form, fields) ->
                snapshot.put(form, Collections.unmodifiableMap(new LinkedHashMap<>(fields))));
        return Collections.unmodifiableMap(snapshot);
    }
}
