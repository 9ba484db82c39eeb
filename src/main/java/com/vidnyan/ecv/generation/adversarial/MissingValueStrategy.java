package com.vidnyan.ecv.generation.adversarial;

import com.vidnyan.ecv.domain.condition.FieldRef;
import com.vidnyan.ecv.domain.condition.RuleAnalysis;
import com.vidnyan.ecv.domain.model.TestCase;
import com.vidnyan.ecv.domain.model.TestData;
import com.vidnyan.ecv.generation.TestDataPlanner;
import com.vidnyan.ecv.generation.ValueSampler;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Each referenced field omitted from its form in turn.
 */
@Component
public class MissingValueStrategy implements AdversarialStrategy {

    @Override
    public String name() {
        return "missing-value";
    }

    @Override
    public List<TestCase> generate(RuleAnalysis analysis, TestDataPlanner planner, ValueSampler sampler) {
        TestData base = planner.satisfyingAll();
        List<TestCase> tests = new ArrayList<>();
        for (FieldRef ref : analysis.fieldRefs()) {
            tests.add(testCase(analysis, base.copy().remove(ref), false,
                    "Missing value: " + ref + " omitted from " + ref.form()));
        }
        return tests;
    }
}
