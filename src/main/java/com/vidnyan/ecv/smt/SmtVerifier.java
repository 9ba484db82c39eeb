package com.vidnyan.ecv.smt;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import com.vidnyan.ecv.config.EcvProperties;
import com.vidnyan.ecv.domain.condition.ConditionModel;
import com.vidnyan.ecv.domain.condition.ConditionParseException;
import com.vidnyan.ecv.domain.condition.FieldRef;
import com.vidnyan.ecv.domain.condition.RuleAnalysis;
import com.vidnyan.ecv.domain.model.FieldType;
import com.vidnyan.ecv.domain.model.IssueKind;
import com.vidnyan.ecv.domain.model.Rule;
import com.vidnyan.ecv.domain.model.Specification;
import com.vidnyan.ecv.domain.model.TestCase;
import com.vidnyan.ecv.domain.model.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Formal checks of rules with Z3.
 * <p>
 * Every public operation opens its own {@link SolverSession}; each individual check runs in a
 * pushed scope that is popped before the next one. Unknown solver answers become warnings.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SmtVerifier {

    private final ConditionModel conditionModel;
    private final EcvProperties properties;

    /**
     * Satisfiability, tautology, redundancy and null-value checks of one rule.
     */
    public ValidationResult verifyRule(Rule rule, Specification specification) {
        ValidationResult result = new ValidationResult(rule.id());
        verifyRule(rule, specification, result);
        return result;
    }

    /**
     * Same as {@link #verifyRule(Rule, Specification)}, appending to an existing result.
     */
    public void verifyRule(Rule rule, Specification specification, ValidationResult result) {
        if (!rule.hasFormalizedCondition()) {
            result.addError(IssueKind.MISSING_CONDITION, "Rule has no formalized condition");
            return;
        }
        try {
            conditionModel.parser().parseStrict(rule.formalizedCondition());
        } catch (ConditionParseException e) {
            result.addError(IssueKind.PARSING_ERROR, "Failed to parse condition: " + e.getMessage());
            return;
        }

        RuleAnalysis analysis = conditionModel.analyze(rule, specification);
        for (String finding : RedundancyDetector.find(analysis.condition())) {
            result.addWarning(IssueKind.REDUNDANT_CONDITION, finding);
        }

        try (SolverSession session = openSession()) {
            FormulaTranslator translator = new FormulaTranslator(session);
            Optional<BoolExpr> formula = translator.translate(analysis);
            if (formula.isEmpty()) {
                result.addError(IssueKind.VERIFICATION_ERROR, "No part of the condition could be translated");
                return;
            }

            // 1. satisfiability
            Status satisfiable = session.check(formula.get());
            if (satisfiable == Status.UNSATISFIABLE) {
                result.addError(IssueKind.UNSATISFIABLE_RULE, "Rule condition can never be true");
                return;
            }
            if (satisfiable == Status.UNKNOWN) {
                result.addWarning(IssueKind.SOLVER_UNKNOWN, "Solver could not decide satisfiability");
                return;
            }

            // 2. tautology
            Status negation = session.check(session.context().mkNot(formula.get()));
            if (negation == Status.UNSATISFIABLE) {
                result.addWarning(IssueKind.TAUTOLOGY, "Rule condition is always true");
            } else if (negation == Status.UNKNOWN) {
                result.addWarning(IssueKind.SOLVER_UNKNOWN, "Solver could not decide whether the rule is a tautology");
            }

            // 3. all-null probe
            List<BoolExpr> nulls = new ArrayList<>();
            nulls.add(formula.get());
            for (FieldRef ref : analysis.fieldRefs()) {
                if (analysis.typeOf(ref) != FieldType.BOOLEAN) {
                    nulls.add(translator.isNull(ref));
                }
            }
            if (nulls.size() > 1 && session.isSatisfiable(nulls.toArray(new BoolExpr[0]))) {
                result.addWarning(IssueKind.NULL_VALUES_SATISFY_RULE,
                        "Rule condition can be satisfied when its fields are missing");
            }
            log.debug("Verified rule {} with {} solver checks", rule.id(), session.checkCount());
        } catch (Z3Exception e) {
            log.warn("Solver failure verifying rule {}: {}", rule.id(), e.getMessage());
            result.addError(IssueKind.VERIFICATION_ERROR, "Solver failure: " + e.getMessage());
        }
    }

    /**
     * Per-rule checks plus pairwise contradiction and implication across the set.
     * Results are aligned with the input order.
     */
    public List<ValidationResult> verifyRuleSet(List<Rule> rules, Specification specification) {
        List<ValidationResult> results = new ArrayList<>();
        for (Rule rule : rules) {
            results.add(verifyRule(rule, specification));
        }

        List<Integer> candidates = new ArrayList<>();
        for (int i = 0; i < rules.size(); i++) {
            ValidationResult r = results.get(i);
            if (rules.get(i).hasFormalizedCondition()
                    && !r.hasError(IssueKind.PARSING_ERROR)
                    && !r.hasError(IssueKind.UNSATISFIABLE_RULE)
                    && !r.hasError(IssueKind.VERIFICATION_ERROR)) {
                candidates.add(i);
            }
        }

        int maxPairs = properties.getVerification().getMaxRulePairs();
        long totalPairs = (long) candidates.size() * (candidates.size() - 1) / 2;
        if (maxPairs > 0 && totalPairs > maxPairs) {
            log.warn("Rule set has {} rule pairs, checking the first {} only", totalPairs, maxPairs);
        }

        try (SolverSession session = openSession()) {
            FormulaTranslator translator = new FormulaTranslator(session);
            List<BoolExpr> formulas = new ArrayList<>();
            for (int index : candidates) {
                RuleAnalysis analysis = conditionModel.analyze(rules.get(index), specification);
                formulas.add(translator.translate(analysis).orElse(null));
            }

            int checked = 0;
            pairs:
            for (int a = 0; a < candidates.size(); a++) {
                for (int b = a + 1; b < candidates.size(); b++) {
                    if (maxPairs > 0 && checked >= maxPairs) {
                        break pairs;
                    }
                    if (formulas.get(a) == null || formulas.get(b) == null) {
                        continue;
                    }
                    checked++;
                    comparePair(session,
                            rules.get(candidates.get(a)), formulas.get(a), results.get(candidates.get(a)),
                            rules.get(candidates.get(b)), formulas.get(b), results.get(candidates.get(b)));
                }
            }
            log.info("Rule set verification: {} rules, {} pairs, {} solver checks",
                    rules.size(), checked, session.checkCount());
        } catch (Z3Exception e) {
            log.error("Solver failure during rule-set verification: {}", e.getMessage());
            results.forEach(r -> r.addWarning(IssueKind.SOLVER_UNKNOWN, "Rule-set checks aborted: " + e.getMessage()));
        }
        return results;
    }

    private void comparePair(SolverSession session,
                             Rule ruleA, BoolExpr a, ValidationResult resultA,
                             Rule ruleB, BoolExpr b, ValidationResult resultB) {
        Status joint = session.check(a, b);
        if (joint == Status.UNSATISFIABLE) {
            resultA.addError(IssueKind.CONTRADICTORY_RULES,
                    "Rule contradicts rule " + ruleB.id(), Map.of("otherRule", ruleB.id()));
            resultB.addError(IssueKind.CONTRADICTORY_RULES,
                    "Rule contradicts rule " + ruleA.id(), Map.of("otherRule", ruleA.id()));
            return;
        }
        if (joint == Status.UNKNOWN) {
            resultA.addWarning(IssueKind.SOLVER_UNKNOWN, "Could not decide consistency with rule " + ruleB.id());
            resultB.addWarning(IssueKind.SOLVER_UNKNOWN, "Could not decide consistency with rule " + ruleA.id());
            return;
        }

        // A implies B when A AND NOT B has no model
        if (session.check(a, session.context().mkNot(b)) == Status.UNSATISFIABLE) {
            resultB.addWarning(IssueKind.IMPLIED_RULE,
                    "Rule is implied by rule " + ruleA.id(), Map.of("impliedBy", ruleA.id()));
        }
        if (session.check(b, session.context().mkNot(a)) == Status.UNSATISFIABLE) {
            resultA.addWarning(IssueKind.IMPLIED_RULE,
                    "Rule is implied by rule " + ruleB.id(), Map.of("impliedBy", ruleB.id()));
        }
    }

    /**
     * Truth value of a rule's formalized condition on a test case's data.
     * Empty when the rule cannot be translated or the data leaves the value undetermined.
     */
    public Optional<Boolean> evaluate(Rule rule, Specification specification, TestCase testCase) {
        if (!rule.hasFormalizedCondition()) {
            return Optional.empty();
        }
        RuleAnalysis analysis = conditionModel.analyze(rule, specification);
        if (!analysis.isParsed()) {
            return Optional.empty();
        }
        try (SolverSession session = openSession()) {
            FormulaTranslator translator = new FormulaTranslator(session);
            Optional<BoolExpr> formula = translator.translate(analysis);
            if (formula.isEmpty()) {
                return Optional.empty();
            }
            List<BoolExpr> bindings = new ArrayList<>();
            for (FieldRef ref : analysis.fieldRefs()) {
                BoolExpr binding = translator.bind(ref, testCase.value(ref).orElse(null));
                if (binding != null) {
                    bindings.add(binding);
                }
            }
            List<BoolExpr> whenTrue = new ArrayList<>(bindings);
            whenTrue.add(formula.get());
            List<BoolExpr> whenFalse = new ArrayList<>(bindings);
            whenFalse.add(session.context().mkNot(formula.get()));

            Status canBeTrue = session.check(whenTrue.toArray(new BoolExpr[0]));
            Status canBeFalse = session.check(whenFalse.toArray(new BoolExpr[0]));
            if (canBeTrue == Status.SATISFIABLE && canBeFalse == Status.UNSATISFIABLE) {
                return Optional.of(true);
            }
            if (canBeTrue == Status.UNSATISFIABLE && canBeFalse == Status.SATISFIABLE) {
                return Optional.of(false);
            }
            return Optional.empty();
        } catch (Z3Exception e) {
            log.debug("Solver failure evaluating rule {}: {}", rule.id(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Whether every model of {@code premise} satisfies {@code conclusion}.
     * Empty when either rule is not translatable or the solver gives up.
     */
    public Optional<Boolean> implies(Rule premise, Rule conclusion, Specification specification) {
        if (!premise.hasFormalizedCondition() || !conclusion.hasFormalizedCondition()) {
            return Optional.empty();
        }
        try (SolverSession session = openSession()) {
            FormulaTranslator translator = new FormulaTranslator(session);
            Optional<BoolExpr> p = translator.translate(conditionModel.analyze(premise, specification));
            Optional<BoolExpr> c = translator.translate(conditionModel.analyze(conclusion, specification));
            if (p.isEmpty() || c.isEmpty()) {
                return Optional.empty();
            }
            Status status = session.check(p.get(), session.context().mkNot(c.get()));
            return switch (status) {
                case UNSATISFIABLE -> Optional.of(true);
                case SATISFIABLE -> Optional.of(false);
                default -> Optional.empty();
            };
        } catch (Z3Exception e) {
            log.debug("Solver failure checking {} => {}: {}", premise.id(), conclusion.id(), e.getMessage());
            return Optional.empty();
        }
    }

    private SolverSession openSession() {
        return SolverSession.open(properties.getGeneration().getTaskTimeout());
    }
}
