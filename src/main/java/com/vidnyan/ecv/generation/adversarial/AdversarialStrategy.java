package com.vidnyan.ecv.generation.adversarial;

import com.vidnyan.ecv.domain.condition.RuleAnalysis;
import com.vidnyan.ecv.domain.model.TestCase;
import com.vidnyan.ecv.domain.model.TestData;
import com.vidnyan.ecv.domain.model.Technique;
import com.vidnyan.ecv.generation.TestDataPlanner;
import com.vidnyan.ecv.generation.ValueSampler;

import java.util.List;

/**
 * One way of attacking a rule with edge-case data.
 * Fields a strategy does not target keep values satisfying the rule's other comparisons,
 * so the targeted field decides the outcome.
 */
public interface AdversarialStrategy {

    String name();

    List<TestCase> generate(RuleAnalysis analysis, TestDataPlanner planner, ValueSampler sampler);

    default TestCase testCase(RuleAnalysis analysis, TestData data, boolean expected, String description) {
        return TestCase.builder()
                .ruleId(analysis.rule().id())
                .description(description)
                .expectedResult(expected)
                .testData(data)
                .technique(Technique.ADVERSARIAL)
                .build();
    }
}
