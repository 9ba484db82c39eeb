package com.vidnyan.ecv.verification;

import com.vidnyan.ecv.domain.condition.RuleAnalysis;
import com.vidnyan.ecv.domain.model.TestCase;
import com.vidnyan.ecv.smt.SmtVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Checks a test against rules that share fields with its own rule.
 * <p>
 * If the rule implies R and the test expects true, R must hold on the data. If R implies the
 * rule and the test expects false, R must fail on the data. Without such an implication
 * there is no opinion.
 */
@Slf4j
@Component
@Order(3)
@RequiredArgsConstructor
public class CrossRuleValidationMode implements VerificationMode {

    private final SmtVerifier smtVerifier;
    private final SafeConditionEvaluator evaluator;

    @Override
    public String name() {
        return "cross-rule";
    }

    @Override
    public Optional<Boolean> opinion(VerificationContext context, TestCase testCase) {
        boolean consulted = false;
        for (RuleAnalysis related : context.relatedRules()) {
            boolean expected = testCase.expectedResult();
            Optional<Boolean> implied = expected
                    ? context.implication(context.rule(), related.rule(),
                            () -> smtVerifier.implies(context.rule(), related.rule(), context.specification()))
                    : context.implication(related.rule(), context.rule(),
                            () -> smtVerifier.implies(related.rule(), context.rule(), context.specification()));
            if (!implied.orElse(false)) {
                continue;
            }
            Optional<Boolean> actual = valueOf(related, testCase);
            if (actual.isEmpty()) {
                continue;
            }
            if (actual.get() != expected) {
                log.debug("Test '{}' contradicts related rule {}", testCase.description(), related.rule().id());
                return Optional.of(false);
            }
            consulted = true;
        }
        return consulted ? Optional.of(true) : Optional.empty();
    }

    private Optional<Boolean> valueOf(RuleAnalysis related, TestCase testCase) {
        Optional<Boolean> solved = smtVerifier.evaluate(related.rule(), related.specification(), testCase);
        return solved.isPresent() ? solved : evaluator.evaluate(related, testCase);
    }
}
