package com.vidnyan.ecv.generation;

import com.vidnyan.ecv.config.EcvProperties;
import com.vidnyan.ecv.domain.condition.ComparisonOperator;
import com.vidnyan.ecv.domain.condition.ConditionModel;
import com.vidnyan.ecv.domain.condition.FieldRef;
import com.vidnyan.ecv.domain.condition.RuleAnalysis;
import com.vidnyan.ecv.domain.graph.CausalEdge;
import com.vidnyan.ecv.domain.graph.CausalGraph;
import com.vidnyan.ecv.domain.graph.CausalGraphBuilder;
import com.vidnyan.ecv.domain.model.Field;
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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Intervention, counterfactual and confounding cases driven by the rule's causal graph.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CausalTestGenerator implements TestGenerationTechnique {

    private static final int TEMPORAL_MAX_DAYS = 30;
    private static final int FORM_OFFSET = 10;
    private static final int COUNTERFACTUAL_DAYS = 180;
    private static final int SECONDS_PER_DAY = 86_400;

    private final ConditionModel conditionModel;
    private final CausalGraphBuilder graphBuilder;
    private final EcvProperties properties;

    @Override
    public Technique technique() {
        return Technique.CAUSAL;
    }

    @Override
    public List<TestCase> generate(Rule rule, Specification specification) {
        RuleAnalysis analysis = conditionModel.analyze(rule, specification);
        CausalGraph graph = graphBuilder.build(analysis);
        if (graph.isEmpty()) {
            return List.of();
        }

        ValueSampler sampler = ValueSampler.create(properties.getGeneration().getSeed());
        TestData base = new TestDataPlanner(analysis, sampler).satisfyingAll();
        EcvProperties.Causal config = properties.getCausal();

        List<TestCase> tests = new ArrayList<>();
        tests.addAll(interventions(analysis, graph, base, sampler, config.getInterventionTopK()));
        tests.addAll(counterfactuals(analysis, graph, base, sampler, config.getCounterfactualTopK()));
        confounding(analysis, graph, base, sampler).ifPresent(tests::add);
        return tests;
    }

    private List<TestCase> interventions(RuleAnalysis analysis, CausalGraph graph, TestData base,
                                         ValueSampler sampler, int topK) {
        List<TestCase> tests = new ArrayList<>();
        for (FieldRef node : graph.topByDegree(topK)) {
            for (Object probe : probeValues(analysis, node, sampler)) {
                TestData data = intervene(analysis, graph, base, node, probe, sampler);
                tests.add(testCase(analysis, data, true,
                        "Causal intervention: do(" + node + " = " + probe + ") propagated to "
                                + graph.descendants(node).size() + " descendants"));
            }
        }
        return tests;
    }

    /**
     * Sets {@code node} to {@code value} and pushes the change along the breadth-first tree.
     * Only the node and its descendants change.
     */
    TestData intervene(RuleAnalysis analysis, CausalGraph graph, TestData base,
                       FieldRef node, Object value, ValueSampler sampler) {
        TestData data = base.copy().put(node, value);
        for (CausalEdge edge : graph.spanningTree(node)) {
            Optional<Object> source = data.get(edge.source());
            if (source.isEmpty()) {
                continue;
            }
            propagate(analysis, edge, source.get(), data.get(edge.target()).orElse(null), sampler)
                    .ifPresent(v -> data.put(edge.target(), v));
        }
        return data;
    }

    private Optional<Object> propagate(RuleAnalysis analysis, CausalEdge edge, Object sourceValue,
                                       Object targetValue, ValueSampler sampler) {
        FieldType sourceType = analysis.typeOf(edge.source());
        FieldType targetType = analysis.typeOf(edge.target());
        return switch (edge.type()) {
            case TEMPORAL -> FieldValues.toEpochDay(sourceValue)
                    .map(day -> FieldValues.fromScale(targetType, day + sampler.integer(1, TEMPORAL_MAX_DAYS)));
            case FORM -> {
                if (!targetType.isOrdered() || targetValue == null) {
                    yield Optional.empty();
                }
                int offset = sampler.integer(-FORM_OFFSET, FORM_OFFSET);
                double scale = targetType == FieldType.TIME ? 60.0 : 1.0;
                yield FieldValues.toScale(targetType, targetValue)
                        .map(v -> FieldValues.fromScale(targetType, v + offset * scale));
            }
            case COMPARISON -> {
                // edge reads "source op target", so the target must satisfy "target converse(op) source"
                ComparisonOperator op = edge.operator().converse();
                if (sourceType.isOrdered() && targetType.isOrdered()) {
                    yield FieldValues.toScale(sourceType, sourceValue)
                            .map(s -> FieldValues.fromScale(targetType, sampler.satisfying(targetType, op, s)));
                }
                if (op == ComparisonOperator.EQ) {
                    yield Optional.of(sourceValue);
                }
                if (op == ComparisonOperator.NE) {
                    yield Optional.of(sampler.otherCategory(sourceValue.toString(),
                            analysis.field(edge.target()).orElse(null)));
                }
                yield Optional.empty();
            }
        };
    }

    private List<Object> probeValues(RuleAnalysis analysis, FieldRef node, ValueSampler sampler) {
        FieldType type = analysis.typeOf(node);
        Field field = analysis.field(node).orElse(null);
        return switch (type) {
            case NUMERIC -> List.of(0.0, 10.0, 100.0);
            case DATE, DATETIME -> List.of(
                    FieldValues.REFERENCE_DATE.toString(),
                    FieldValues.REFERENCE_DATE.minusDays(30).toString(),
                    FieldValues.REFERENCE_DATE.plusDays(30).toString());
            case CATEGORICAL -> field != null && field.hasValidValues()
                    ? List.<Object>copyOf(field.validValues())
                    : List.of(sampler.defaultValue(type, field));
            case BOOLEAN -> List.of(true, false);
            case TIME, TEXT -> List.of(sampler.defaultValue(type, field));
        };
    }

    private List<TestCase> counterfactuals(RuleAnalysis analysis, CausalGraph graph, TestData base,
                                           ValueSampler sampler, int topK) {
        List<TestCase> tests = new ArrayList<>();
        for (FieldRef node : graph.topByDegree(topK)) {
            Optional<Object> original = base.get(node);
            if (original.isEmpty()) {
                continue;
            }
            Optional<Object> opposite = opposite(analysis, node, original.get(), sampler);
            if (opposite.isEmpty()) {
                continue;
            }
            TestData data = base.copy().put(node, opposite.get());
            tests.add(testCase(analysis, data, false,
                    "Causal counterfactual: " + node + " " + original.get() + " -> " + opposite.get()));
        }
        return tests;
    }

    private Optional<Object> opposite(RuleAnalysis analysis, FieldRef node, Object value, ValueSampler sampler) {
        FieldType type = analysis.typeOf(node);
        return switch (type) {
            case NUMERIC -> FieldValues.toScale(type, value)
                    .map(v -> v == 0.0 ? -1.0 : -v);
            case DATE, DATETIME -> FieldValues.toScale(type, value)
                    .map(v -> FieldValues.fromScale(type, v + COUNTERFACTUAL_DAYS));
            case TIME -> FieldValues.toScale(type, value)
                    .map(v -> FieldValues.fromScale(type, (v + SECONDS_PER_DAY / 2.0) % SECONDS_PER_DAY));
            case BOOLEAN -> FieldValues.toBoolean(value).map(b -> !b);
            case CATEGORICAL, TEXT -> Optional.of(
                    sampler.otherCategory(value.toString(), analysis.field(node).orElse(null)));
        };
    }

    private Optional<TestCase> confounding(RuleAnalysis analysis, CausalGraph graph, TestData base,
                                           ValueSampler sampler) {
        List<FieldRef> confounders = graph.confounders();
        if (confounders.isEmpty()) {
            return Optional.empty();
        }
        TestData data = base.copy();
        Set<FieldRef> descendants = new LinkedHashSet<>();
        for (FieldRef confounder : confounders) {
            data.put(confounder, sampler.defaultValue(analysis.typeOf(confounder),
                    analysis.field(confounder).orElse(null)));
            descendants.addAll(graph.descendants(confounder));
        }
        descendants.removeAll(confounders);

        List<FieldRef> candidates = new ArrayList<>(descendants);
        List<FieldRef> chosen = new ArrayList<>();
        while (chosen.size() < 2 && !candidates.isEmpty()) {
            chosen.add(candidates.remove(sampler.integer(0, candidates.size() - 1)));
        }
        for (FieldRef ref : chosen) {
            data.put(ref, sampler.defaultValue(analysis.typeOf(ref), analysis.field(ref).orElse(null)));
        }
        return Optional.of(testCase(analysis, data, true,
                "Causal confounding: " + confounders + " with independent " + chosen));
    }

    private TestCase testCase(RuleAnalysis analysis, TestData data, boolean expected, String description) {
        return TestCase.builder()
                .ruleId(analysis.rule().id())
                .description(description)
                .expectedResult(expected)
                .testData(data)
                .technique(Technique.CAUSAL)
                .build();
    }
}
