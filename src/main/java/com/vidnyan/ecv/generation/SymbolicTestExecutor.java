package com.vidnyan.ecv.generation;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Model;
import com.microsoft.z3.Z3Exception;
import com.vidnyan.ecv.config.EcvProperties;
import com.vidnyan.ecv.domain.condition.Condition;
import com.vidnyan.ecv.domain.condition.ConditionModel;
import com.vidnyan.ecv.domain.condition.FieldRef;
import com.vidnyan.ecv.domain.condition.Literal;
import com.vidnyan.ecv.domain.condition.RuleAnalysis;
import com.vidnyan.ecv.domain.model.FieldType;
import com.vidnyan.ecv.domain.model.Rule;
import com.vidnyan.ecv.domain.model.Specification;
import com.vidnyan.ecv.domain.model.TestCase;
import com.vidnyan.ecv.domain.model.TestData;
import com.vidnyan.ecv.domain.model.Technique;
import com.vidnyan.ecv.smt.FormulaTranslator;
import com.vidnyan.ecv.smt.SolverSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Solves a rule's condition for concrete test data.
 * <p>
 * Produces a satisfying case, a violating case, and for every numeric field a pair of boundary
 * cases one epsilon either side of the point where satisfiability flips. The flip point is
 * located by bisection with a fixed iteration cap.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SymbolicTestExecutor implements TestGenerationTechnique {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private final ConditionModel conditionModel;
    private final EcvProperties properties;

    @Override
    public Technique technique() {
        return Technique.SYMBOLIC;
    }

    @Override
    public boolean supports(Rule rule) {
        return rule.hasFormalizedCondition();
    }

    @Override
    public List<TestCase> generate(Rule rule, Specification specification) {
        RuleAnalysis analysis = conditionModel.analyze(rule, specification);
        if (analysis.fieldRefs().isEmpty()) {
            log.debug("Rule {} references no fields, nothing to solve", rule.id());
            return List.of();
        }

        List<TestCase> tests = new ArrayList<>();
        try (SolverSession session = SolverSession.open(properties.getGeneration().getTaskTimeout())) {
            FormulaTranslator translator = new FormulaTranslator(session);
            Optional<BoolExpr> translated = translator.translate(analysis);
            if (translated.isEmpty()) {
                log.debug("Rule {} has no translatable comparisons", rule.id());
                return List.of();
            }
            BoolExpr formula = translated.get();
            BoolExpr negation = session.context().mkNot(formula);
            BoolExpr domain = domain(analysis, translator, session);

            solve(session, translator, analysis, domain, formula)
                    .ifPresent(data -> tests.add(testCase(rule, data, true,
                            "Symbolic: assignment satisfying the condition")));
            solve(session, translator, analysis, domain, negation)
                    .ifPresent(data -> tests.add(testCase(rule, data, false,
                            "Symbolic: assignment violating the condition")));

            for (FieldRef ref : analysis.fieldRefs()) {
                if (analysis.typeOf(ref) == FieldType.NUMERIC) {
                    tests.addAll(boundaryCases(rule, analysis, session, translator, formula, negation, ref));
                }
            }
        } catch (Z3Exception e) {
            log.warn("Solver failure generating symbolic tests for rule {}: {}", rule.id(), e.getMessage());
        }
        log.debug("Rule {}: {} symbolic test cases", rule.id(), tests.size());
        return tests;
    }

    private BoolExpr domain(RuleAnalysis analysis, FormulaTranslator translator, SolverSession session) {
        List<BoolExpr> parts = new ArrayList<>();
        for (FieldRef ref : analysis.fieldRefs()) {
            analysis.field(ref).ifPresent(field -> parts.add(translator.domain(ref, field)));
        }
        return parts.isEmpty()
                ? session.context().mkTrue()
                : session.context().mkAnd(parts.toArray(new BoolExpr[0]));
    }

    /**
     * Model of the goal inside the declared field domains, or without them when that fails.
     */
    private Optional<TestData> solve(SolverSession session, FormulaTranslator translator,
                                     RuleAnalysis analysis, BoolExpr domain, BoolExpr goal) {
        Optional<TestData> bounded = session.solve(model -> toTestData(model, translator, analysis), domain, goal);
        if (bounded.isPresent()) {
            return bounded;
        }
        return session.solve(model -> toTestData(model, translator, analysis), goal);
    }

    private List<TestCase> boundaryCases(Rule rule, RuleAnalysis analysis, SolverSession session,
                                         FormulaTranslator translator, BoolExpr formula, BoolExpr negation,
                                         FieldRef ref) {
        EcvProperties.Symbolic config = properties.getSymbolic();
        BigDecimal low = BigDecimal.valueOf(config.getSearchLow());
        BigDecimal high = BigDecimal.valueOf(config.getSearchHigh());
        BigDecimal epsilon = BigDecimal.valueOf(config.getEpsilon());

        boolean lowSat = session.isSatisfiable(formula, translator.equalsScale(ref, low));
        boolean highSat = session.isSatisfiable(formula, translator.equalsScale(ref, high));
        if (lowSat == highSat) {
            log.debug("No satisfiability flip for {} in [{}, {}]", ref, low, high);
            return List.of();
        }

        for (int i = 0; i < config.getBisectionIterations(); i++) {
            BigDecimal mid = low.add(high).divide(TWO);
            if (session.isSatisfiable(formula, translator.equalsScale(ref, mid)) == lowSat) {
                low = mid;
            } else {
                high = mid;
            }
        }

        Optional<BigDecimal> threshold = literalThreshold(analysis, ref, low, high);
        BigDecimal boundary = threshold.orElse(low.add(high).divide(TWO));
        BigDecimal below = boundary.subtract(epsilon);
        BigDecimal above = boundary.add(epsilon);

        Optional<Probe> belowProbe = probe(session, translator, analysis, formula, negation, ref, below);
        Optional<Probe> aboveProbe = probe(session, translator, analysis, formula, negation, ref, above);
        if (belowProbe.isEmpty() || aboveProbe.isEmpty()
                || belowProbe.get().expected() == aboveProbe.get().expected()) {
            // flip lies between the bracket ends, not within epsilon of the midpoint
            below = low;
            above = high;
            belowProbe = probe(session, translator, analysis, formula, negation, ref, below);
            aboveProbe = probe(session, translator, analysis, formula, negation, ref, above);
            if (belowProbe.isEmpty() || aboveProbe.isEmpty()) {
                return List.of();
            }
        }

        String boundaryText = boundary.stripTrailingZeros().toPlainString();
        return List.of(
                testCase(rule, belowProbe.get().data(), belowProbe.get().expected(),
                        "Symbolic boundary: " + ref + " = " + below.stripTrailingZeros().toPlainString()
                                + " just below " + boundaryText),
                testCase(rule, aboveProbe.get().data(), aboveProbe.get().expected(),
                        "Symbolic boundary: " + ref + " = " + above.stripTrailingZeros().toPlainString()
                                + " just above " + boundaryText));
    }

    /**
     * A literal the field is compared against that lies inside the final bisection bracket.
     */
    private Optional<BigDecimal> literalThreshold(RuleAnalysis analysis, FieldRef ref,
                                                  BigDecimal low, BigDecimal high) {
        return analysis.literalComparisons().stream()
                .filter(c -> c.left().equals(ref))
                .map(Condition.Comparison::right)
                .map(Literal.class::cast)
                .filter(Literal::isNumber)
                .map(Literal::asNumber)
                .filter(t -> t.compareTo(low) >= 0 && t.compareTo(high) <= 0)
                .findFirst();
    }

    /**
     * Test data with the field fixed at {@code value}, labelled by whether the condition can hold there.
     */
    private Optional<Probe> probe(SolverSession session, FormulaTranslator translator, RuleAnalysis analysis,
                                  BoolExpr formula, BoolExpr negation, FieldRef ref, BigDecimal value) {
        BoolExpr fixed = translator.equalsScale(ref, value);
        Optional<TestData> satisfying = session.solve(model -> toTestData(model, translator, analysis), formula, fixed);
        if (satisfying.isPresent()) {
            return Optional.of(new Probe(satisfying.get(), true));
        }
        return session.solve(model -> toTestData(model, translator, analysis), negation, fixed)
                .map(data -> new Probe(data, false));
    }

    private TestData toTestData(Model model, FormulaTranslator translator, RuleAnalysis analysis) {
        TestData data = TestData.empty();
        for (FieldRef ref : analysis.fieldRefs()) {
            Optional<Object> value = translator.read(model, ref);
            if (value.isPresent()) {
                data.put(ref, value.get());
            } else {
                data.remove(ref);
            }
        }
        return data;
    }

    private TestCase testCase(Rule rule, TestData data, boolean expected, String description) {
        return TestCase.builder()
                .ruleId(rule.id())
                .description(description)
                .expectedResult(expected)
                .testData(data)
                .technique(Technique.SYMBOLIC)
                .build();
    }

    private record Probe(TestData data, boolean expected) {}

}
