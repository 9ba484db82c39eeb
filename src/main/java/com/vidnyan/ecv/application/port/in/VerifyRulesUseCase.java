package com.vidnyan.ecv.application.port.in;

import com.vidnyan.ecv.domain.model.Rule;
import com.vidnyan.ecv.domain.model.Specification;
import com.vidnyan.ecv.domain.model.ValidationResult;

import java.util.List;

/**
 * Use case: check rules for structural and logical defects.
 */
public interface VerifyRulesUseCase {

    ValidationResult verifyRule(Rule rule, Specification specification);

    /**
     * Per-rule results in input order, including contradictions and implications between rules.
     */
    List<ValidationResult> verifyRuleSet(List<Rule> rules, Specification specification);
}
