package com.vidnyan.ecv.application.service;

import com.vidnyan.ecv.application.port.in.VerifyRulesUseCase;
import com.vidnyan.ecv.domain.model.Rule;
import com.vidnyan.ecv.domain.model.Specification;
import com.vidnyan.ecv.domain.model.ValidationResult;
import com.vidnyan.ecv.smt.SmtVerifier;
import com.vidnyan.ecv.verification.RuleStructureValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Structural validation against the specification followed by the formal checks.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RuleVerificationService implements VerifyRulesUseCase {

    private final RuleStructureValidator structureValidator;
    private final SmtVerifier smtVerifier;

    @Override
    public ValidationResult verifyRule(Rule rule, Specification specification) {
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(specification, "specification");
        ValidationResult result = new ValidationResult(rule.id());
        structureValidator.validate(rule, specification, result);
        smtVerifier.verifyRule(rule, specification, result);
        log.debug("Verified rule {}: {}", rule.id(), result);
        return result;
    }

    @Override
    public List<ValidationResult> verifyRuleSet(List<Rule> rules, Specification specification) {
        Objects.requireNonNull(rules, "rules");
        Objects.requireNonNull(specification, "specification");
        log.info("Verifying rule set of {} rules", rules.size());
        List<ValidationResult> results = smtVerifier.verifyRuleSet(rules, specification);
        for (int i = 0; i < rules.size(); i++) {
            structureValidator.validate(rules.get(i), specification, results.get(i));
        }
        long invalid = results.stream().filter(r -> !r.isValid()).count();
        log.info("Rule set verification complete: {} of {} rules invalid", invalid, rules.size());
        return results;
    }
}
