package com.vidnyan.ecv.generation.adversarial;

import com.vidnyan.ecv.application.port.out.MutationProposer;
import com.vidnyan.ecv.config.EcvProperties;
import com.vidnyan.ecv.domain.condition.ConditionModel;
import com.vidnyan.ecv.domain.condition.RuleAnalysis;
import com.vidnyan.ecv.domain.model.Rule;
import com.vidnyan.ecv.domain.model.Specification;
import com.vidnyan.ecv.domain.model.TestCase;
import com.vidnyan.ecv.domain.model.Technique;
import com.vidnyan.ecv.generation.TestDataPlanner;
import com.vidnyan.ecv.generation.TestGenerationTechnique;
import com.vidnyan.ecv.generation.ValueSampler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs every {@link AdversarialStrategy} against a rule, then asks the
 * {@link MutationProposer} for extra scenarios. Each strategy and the proposer
 * fail independently.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdversarialTestGenerator implements TestGenerationTechnique {

    private final ConditionModel conditionModel;
    private final EcvProperties properties;
    private final List<AdversarialStrategy> strategies;
    private final MutationProposer mutationProposer;

    @Override
    public Technique technique() {
        return Technique.ADVERSARIAL;
    }

    @Override
    public List<TestCase> generate(Rule rule, Specification specification) {
        RuleAnalysis analysis = conditionModel.analyze(rule, specification);
        List<TestCase> tests = new ArrayList<>();

        if (!analysis.fieldRefs().isEmpty()) {
            ValueSampler sampler = ValueSampler.create(properties.getGeneration().getSeed());
            TestDataPlanner planner = new TestDataPlanner(analysis, sampler);
            for (AdversarialStrategy strategy : strategies) {
                try {
                    List<TestCase> generated = strategy.generate(analysis, planner, sampler);
                    log.debug("Rule {}: {} strategy produced {} cases", rule.id(), strategy.name(), generated.size());
                    tests.addAll(generated);
                } catch (Exception e) {
                    log.error("Adversarial strategy {} failed for rule {}: {}", strategy.name(), rule.id(), e.getMessage());
                }
            }
        }

        tests.addAll(proposed(rule, specification));
        return tests;
    }

    private List<TestCase> proposed(Rule rule, Specification specification) {
        try {
            return mutationProposer.proposeMutations(rule, specification).stream()
                    .map(scenario -> TestCase.builder()
                            .ruleId(rule.id())
                            .description(scenario.description())
                            .expectedResult(scenario.expectedResult())
                            .testData(scenario.testData())
                            .technique(Technique.LLM)
                            .build())
                    .toList();
        } catch (Exception e) {
            log.warn("Mutation proposals unavailable for rule {}: {}", rule.id(), e.getMessage());
            return List.of();
        }
    }
}
