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
 * Values of an incompatible type substituted for each field.
 */
@Component
public class TypeConfusionStrategy implements AdversarialStrategy {

    @Override
    public String name() {
        return "type-confusion";
    }

    @Override
    public List<TestCase> generate(RuleAnalysis analysis, TestDataPlanner planner, ValueSampler sampler) {
        TestData base = planner.satisfyingAll();
        List<TestCase> tests = new ArrayList<>();
        for (FieldRef ref : analysis.fieldRefs()) {
            FieldType type = analysis.typeOf(ref);
            Object wrong = confusingValue(type);
            tests.add(testCase(analysis, base.copy().put(ref, wrong), false,
                    "Type confusion: " + ref + " (" + type.code() + ") = " + wrong));
        }
        return tests;
    }

    static Object confusingValue(FieldType type) {
        return switch (type) {
            case NUMERIC -> "not_a_number";
            case DATE, DATETIME, TIME -> "not_a_date";
            case CATEGORICAL -> "invalid_category";
            case BOOLEAN -> "maybe";
            case TEXT -> 12345;
        };
    }
}
