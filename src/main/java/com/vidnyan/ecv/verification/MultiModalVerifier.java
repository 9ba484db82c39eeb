package com.vidnyan.ecv.verification;

import com.vidnyan.ecv.domain.condition.ConditionModel;
import com.vidnyan.ecv.domain.condition.FieldRef;
import com.vidnyan.ecv.domain.condition.RuleAnalysis;
import com.vidnyan.ecv.domain.model.Rule;
import com.vidnyan.ecv.domain.model.Specification;
import com.vidnyan.ecv.domain.model.TestCase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Keeps a candidate test case only when a strict majority of the opinions returned by the
 * {@link VerificationMode}s confirm its expected result. No opinion at all means discard.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MultiModalVerifier {

    private final ConditionModel conditionModel;
    private final List<VerificationMode> modes;

    /**
     * Verified subset of {@code candidates}, in their original order.
     */
    public List<TestCase> verify(Rule rule, Specification specification,
                                 List<TestCase> candidates, List<Rule> ruleSet) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        VerificationContext context = context(rule, specification, ruleSet);
        List<TestCase> verified = new ArrayList<>();
        for (TestCase candidate : candidates) {
            if (isConfirmed(context, candidate)) {
                verified.add(candidate);
            }
        }
        log.debug("Rule {}: {}/{} test cases verified", rule.id(), verified.size(), candidates.size());
        return verified;
    }

    public VerificationContext context(Rule rule, Specification specification, List<Rule> ruleSet) {
        RuleAnalysis analysis = conditionModel.analyze(rule, specification);
        List<RuleAnalysis> related = new ArrayList<>();
        for (Rule other : ruleSet) {
            if (other.id().equals(rule.id())) {
                continue;
            }
            RuleAnalysis otherAnalysis = conditionModel.analyze(other, specification);
            if (sharesField(analysis.fieldRefs(), otherAnalysis.fieldRefs())) {
                related.add(otherAnalysis);
            }
        }
        return new VerificationContext(analysis, related);
    }

    public boolean isConfirmed(VerificationContext context, TestCase candidate) {
        int agree = 0;
        int disagree = 0;
        for (VerificationMode mode : modes) {
            Optional<Boolean> opinion;
            try {
                opinion = mode.opinion(context, candidate);
            } catch (Exception e) {
                log.warn("Verification mode {} failed on rule {}: {}", mode.name(), context.rule().id(), e.getMessage());
                continue;
            }
            if (opinion.isPresent()) {
                if (opinion.get()) {
                    agree++;
                } else {
                    disagree++;
                }
            }
        }
        boolean confirmed = agree > disagree;
        if (!confirmed) {
            log.debug("Discarding '{}' for rule {}: {} agree, {} disagree",
                    candidate.description(), context.rule().id(), agree, disagree);
        }
        return confirmed;
    }

    private static boolean sharesField(List<FieldRef> a, List<FieldRef> b) {
        return !Collections.disjoint(a, b);
    }
}
