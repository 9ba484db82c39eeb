package com.vidnyan.ecv.generation;

import com.vidnyan.ecv.config.EcvProperties;
import com.vidnyan.ecv.domain.condition.Condition.Comparison;
import com.vidnyan.ecv.domain.condition.ConditionModel;
import com.vidnyan.ecv.domain.condition.FieldRef;
import com.vidnyan.ecv.domain.condition.Literal;
import com.vidnyan.ecv.domain.condition.RuleAnalysis;
import com.vidnyan.ecv.domain.model.FieldType;
import com.vidnyan.ecv.domain.model.FieldValues;
import com.vidnyan.ecv.domain.model.Rule;
import com.vidnyan.ecv.domain.model.Specification;
import com.vidnyan.ecv.domain.model.TestCase;
import com.vidnyan.ecv.domain.model.TestData;
import com.vidnyan.ecv.domain.model.Technique;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Base positive/negative cases plus follow-ups labelled by {@link MetamorphicRelations}.
 * Follow-up labels come from the relation table, never from re-evaluating the rule.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetamorphicTester implements TestGenerationTechnique {

    private final ConditionModel conditionModel;
    private final EcvProperties properties;

    @Override
    public Technique technique() {
        return Technique.METAMORPHIC;
    }

    @Override
    public List<TestCase> generate(Rule rule, Specification specification) {
        RuleAnalysis analysis = conditionModel.analyze(rule, specification);
        List<Comparison> comparisons = analysis.comparisons();
        if (comparisons.isEmpty()) {
            log.debug("Rule {} has no comparisons, skipping metamorphic generation", rule.id());
            return List.of();
        }

        ValueSampler sampler = ValueSampler.create(properties.getGeneration().getSeed());
        TestDataPlanner planner = new TestDataPlanner(analysis, sampler);
        List<TestCase> tests = new ArrayList<>();

        TestData positive = planner.satisfyingAll();
        tests.add(testCase(rule, positive, true, "Metamorphic base: all comparisons satisfied"));

        Comparison violated = sampler.pick(comparisons);
        tests.add(testCase(rule, planner.violating(violated), false,
                "Metamorphic base: violates " + violated));

        for (Comparison comparison : analysis.literalComparisons()) {
            tests.addAll(followUps(rule, analysis, positive, comparison));
        }
        return tests;
    }

    private List<TestCase> followUps(Rule rule, RuleAnalysis analysis, TestData base, Comparison comparison) {
        FieldRef ref = (FieldRef) comparison.left();
        FieldType type = analysis.typeOf(ref);
        if (!type.isOrdered()) {
            return List.of();
        }
        Optional<Double> threshold = FieldValues.toScale(type, ((Literal) comparison.right()).value());
        Optional<Double> value = base.get(ref).flatMap(v -> FieldValues.toScale(type, v));
        if (threshold.isEmpty() || value.isEmpty()) {
            return List.of();
        }
        double t = threshold.get();
        double x = value.get();
        if (!comparison.operator().test(x, t)) {
            // the table's premise is that the base satisfies this comparison
            return List.of();
        }

        List<TestCase> tests = new ArrayList<>();
        for (MetamorphicRelations.Entry entry : MetamorphicRelations.forOperator(comparison.operator())) {
            double followUp = entry.relation().apply(x, t, type != FieldType.NUMERIC);
            Object rendered = FieldValues.fromScale(type, followUp);
            TestData data = base.copy().put(ref, rendered);
            tests.add(testCase(rule, data, entry.expectedResult(),
                    "Metamorphic " + entry.relation().code() + " on " + comparison
                            + ": " + FieldValues.fromScale(type, x) + " -> " + rendered));
        }
        return tests;
    }

    private TestCase testCase(Rule rule, TestData data, boolean expected, String description) {
        return TestCase.builder()
                .ruleId(rule.id())
                .description(description)
                .expectedResult(expected)
                .testData(data)
                .technique(Technique.METAMORPHIC)
                .build();
    }
}
