package com.vidnyan.ecv.smt;

import com.vidnyan.ecv.config.EcvProperties;
import com.vidnyan.ecv.domain.condition.ConditionModel;
import com.vidnyan.ecv.domain.model.Field;
import com.vidnyan.ecv.domain.model.FieldType;
import com.vidnyan.ecv.domain.model.Form;
import com.vidnyan.ecv.domain.model.IssueKind;
import com.vidnyan.ecv.domain.model.Rule;
import com.vidnyan.ecv.domain.model.Specification;
import com.vidnyan.ecv.domain.model.TestCase;
import com.vidnyan.ecv.domain.model.Technique;
import com.vidnyan.ecv.domain.model.ValidationResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SmtVerifierTest {

    private final SmtVerifier verifier = new SmtVerifier(new ConditionModel(), new EcvProperties());

    private final Specification specification = Specification.of(
            Form.of("Demographics", Field.of("Age", FieldType.NUMERIC)));

    @Test
    void verifyRuleSet_ShouldFlagContradictoryRules() {
        // Arrange
        List<Rule> rules = List.of(
                Rule.formalized("ADULT", "Demographics.Age >= 18"),
                Rule.formalized("MINOR", "Demographics.Age < 18"));

        // Act
        List<ValidationResult> results = verifier.verifyRuleSet(rules, specification);

        // Assert
        assertEquals(2, results.size());
        assertEquals("ADULT", results.get(0).ruleId());
        assertTrue(results.get(0).hasError(IssueKind.CONTRADICTORY_RULES));
        assertTrue(results.get(1).hasError(IssueKind.CONTRADICTORY_RULES));
        assertFalse(results.get(0).isValid());
    }

    @Test
    void verifyRuleSet_ShouldReportImpliedRule() {
        // Arrange
        List<Rule> rules = List.of(
                Rule.formalized("OVER_30", "Demographics.Age > 30"),
                Rule.formalized("OVER_18", "Demographics.Age > 18"));

        // Act
        List<ValidationResult> results = verifier.verifyRuleSet(rules, specification);

        // Assert
        assertTrue(results.get(1).hasWarning(IssueKind.IMPLIED_RULE));
        assertFalse(results.get(0).hasWarning(IssueKind.IMPLIED_RULE));
        assertTrue(results.get(1).isValid());
    }

    @Test
    void verifyRule_ShouldReportUnsatisfiableCondition() {
        // Act
        ValidationResult result = verifier.verifyRule(
                Rule.formalized("R1", "Demographics.Age > 10 AND Demographics.Age < 5"), specification);

        // Assert
        assertTrue(result.hasError(IssueKind.UNSATISFIABLE_RULE));
        assertFalse(result.isValid());
    }

    @Test
    void verifyRule_ShouldWarnOnTautologyAndRedundancy() {
        // Act
        ValidationResult tautology = verifier.verifyRule(
                Rule.formalized("R2", "Demographics.Age > 10 OR Demographics.Age <= 10"), specification);
        ValidationResult duplicate = verifier.verifyRule(
                Rule.formalized("R3", "Demographics.Age > 10 AND Demographics.Age > 10"), specification);

        // Assert
        assertTrue(tautology.hasWarning(IssueKind.TAUTOLOGY));
        assertTrue(tautology.isValid());
        assertTrue(duplicate.hasWarning(IssueKind.REDUNDANT_CONDITION));
    }

    @Test
    void verifyRule_ShouldReportParsingAndMissingConditions() {
        // Act
        ValidationResult parsing = verifier.verifyRule(Rule.formalized("R4", "Demographics.Age >"), specification);
        ValidationResult missing = verifier.verifyRule(
                Rule.builder().id("R5").condition("Age must be recorded").build(), specification);

        // Assert
        assertTrue(parsing.hasError(IssueKind.PARSING_ERROR));
        assertTrue(missing.hasError(IssueKind.MISSING_CONDITION));
    }

    @Test
    void verifyRule_ShouldWarnWhenMissingValuesSatisfyRule() {
        // Act
        ValidationResult result = verifier.verifyRule(Rule.formalized("R6", "Demographics.Age < 18"), specification);

        // Assert
        assertTrue(result.hasWarning(IssueKind.NULL_VALUES_SATISFY_RULE));
    }

    @Test
    void evaluate_ShouldTreatUncoercibleValuesAsNull() {
        // Arrange
        Rule rule = Rule.formalized("ADULT", "Demographics.Age >= 18");

        // Act
        Optional<Boolean> adult = verifier.evaluate(rule, specification, testCase("ADULT", 25));
        Optional<Boolean> child = verifier.evaluate(rule, specification, testCase("ADULT", 12));
        Optional<Boolean> garbage = verifier.evaluate(rule, specification, testCase("ADULT", "abc"));

        // Assert
        assertEquals(Optional.of(true), adult);
        assertEquals(Optional.of(false), child);
        assertEquals(Optional.of(false), garbage);
    }

    @Test
    void evaluate_ShouldCompareEquality() {
        // Arrange
        Rule rule = Rule.formalized("AGE_30", "Demographics.Age = 30");

        // Act
        ValidationResult result = verifier.verifyRule(rule, specification);
        Optional<Boolean> equal = verifier.evaluate(rule, specification, testCase("AGE_30", 30));
        Optional<Boolean> different = verifier.evaluate(rule, specification, testCase("AGE_30", 31));

        // Assert
        assertTrue(result.isValid());
        assertFalse(result.hasError(IssueKind.UNSATISFIABLE_RULE));
        assertEquals(Optional.of(true), equal);
        assertEquals(Optional.of(false), different);
    }

    @Test
    void implies_ShouldFollowNumericBounds() {
        // Arrange
        Rule over30 = Rule.formalized("OVER_30", "Demographics.Age > 30");
        Rule over18 = Rule.formalized("OVER_18", "Demographics.Age > 18");

        // Assert
        assertEquals(Optional.of(true), verifier.implies(over30, over18, specification));
        assertEquals(Optional.of(false), verifier.implies(over18, over30, specification));
    }

    private static TestCase testCase(String ruleId, Object age) {
        return TestCase.builder()
                .ruleId(ruleId)
                .description("age " + age)
                .expectedResult(true)
                .testData(Map.of("Demographics", Map.of("Age", age)))
                .technique(Technique.SYMBOLIC)
                .build();
    }
}
