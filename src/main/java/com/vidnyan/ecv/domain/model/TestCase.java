package com.vidnyan.ecv.domain.model;

import com.vidnyan.ecv.domain.condition.FieldRef;
import lombok.Builder;

import java.util.Map;
import java.util.Optional;

/**
 * A generated test case for one rule.
 * Immutable value object; test data is {@code form -> field -> value}.
 */
public record TestCase(
    String ruleId,
    String description,
    boolean expectedResult,
    Map<String, Map<String, Object>> testData,
    Technique technique,
    boolean positive
) {

    public TestCase {
        description = description == null ? "" : description;
        testData = testData == null ? Map.of() : TestData.from(testData).toMap();
    }

    /**
     * Value of a field in the test data, empty when absent or null.
     */
    public Optional<Object> value(FieldRef ref) {
        Map<String, Object> fields = testData.get(ref.form());
        return fields == null ? Optional.empty() : Optional.ofNullable(fields.get(ref.field()));
    }

    public TestCase withDescription(String newDescription) {
        return new TestCase(ruleId, newDescription, expectedResult, testData, technique, positive);
    }

    /**
     * Copy whose description carries the {@code [technique]} prefix.
     */
    public TestCase tagged() {
        String prefix = "[" + technique.tag() + "] ";
        return description.startsWith(prefix) ? this : withDescription(prefix + description);
    }

    /**
     * A case expected to fire the rule is a positive case.
     */
    @Builder
    private static TestCase create(String ruleId, String description, boolean expectedResult,
                                   Map<String, Map<String, Object>> testData, Technique technique) {
        return new TestCase(ruleId, description, expectedResult, testData, technique, expectedResult);
    }

    public static class TestCaseBuilder {

        public TestCaseBuilder testData(Map<String, Map<String, Object>> data) {
            this.testData = data;
            return this;
        }

        public TestCaseBuilder testData(TestData data) {
            this.testData = data.toMap();
            return this;
        }
    }
}
