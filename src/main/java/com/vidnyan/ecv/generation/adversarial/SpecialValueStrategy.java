package com.vidnyan.ecv.generation.adversarial;

import com.vidnyan.ecv.domain.condition.FieldRef;
import com.vidnyan.ecv.domain.condition.RuleAnalysis;
import com.vidnyan.ecv.domain.model.FieldType;
import com.vidnyan.ecv.domain.model.TestCase;
import com.vidnyan.ecv.domain.model.TestData;
import com.vidnyan.ecv.generation.TestDataPlanner;
import com.vidnyan.ecv.generation.ValueSampler;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Type-specific edge constants: zero and infinities, epoch extremes, blank and "null" tokens.
 */
@Component
public class SpecialValueStrategy implements AdversarialStrategy {

    private static final List<Object> NUMERIC = List.of(
            0, -1, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY, Double.NaN);
    private static final List<Object> DATES = List.of("1900-01-01", "1970-01-01", "2100-12-31");
    private static final List<Object> TIMES = List.of("00:00", "23:59:59");
    private static final List<Object> TEXT = List.of("", " ", "NULL", "null", "None");
    private static final List<Object> CATEGORICAL = List.of("", " ", "NULL", "null", "None", "OTHER", "Unknown");

    @Override
    public String name() {
        return "special-value";
    }

    @Override
    public List<TestCase> generate(RuleAnalysis analysis, TestDataPlanner planner, ValueSampler sampler) {
        TestData base = planner.satisfyingAll();
        List<TestCase> tests = new ArrayList<>();
        for (FieldRef ref : analysis.fieldRefs()) {
            for (Object value : specialValues(analysis.typeOf(ref))) {
                tests.add(testCase(analysis, base.copy().put(ref, value), false,
                        "Special value: " + ref + " = '" + value + "'"));
            }
        }
        return tests;
    }

    static List<Object> specialValues(FieldType type) {
        return switch (type) {
            case NUMERIC -> NUMERIC;
            case DATE, DATETIME -> DATES;
            case TIME -> TIMES;
            case TEXT -> TEXT;
            case CATEGORICAL -> CATEGORICAL;
            case BOOLEAN -> List.of();
        };
    }
}
