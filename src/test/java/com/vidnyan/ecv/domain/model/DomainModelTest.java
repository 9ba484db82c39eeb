package com.vidnyan.ecv.domain.model;

import com.vidnyan.ecv.domain.condition.FieldRef;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DomainModelTest {

    @Test
    void fieldType_ShouldParseLenientNames() {
        // Assert
        assertEquals(FieldType.NUMERIC, FieldType.fromString(" Integer "));
        assertEquals(FieldType.CATEGORICAL, FieldType.fromString("dropdown"));
        assertEquals(FieldType.BOOLEAN, FieldType.fromString("yes/no"));
        assertEquals(FieldType.DATETIME, FieldType.fromString("timestamp"));
        assertEquals(FieldType.TEXT, FieldType.fromString("signature"));
        assertEquals(FieldType.TEXT, FieldType.fromString(null));
    }

    @Test
    void rule_ShouldDeriveFormalizedCopy() {
        // Arrange
        Rule rule = Rule.builder()
                .id("AGE-001")
                .condition("Subject must be an adult")
                .severity(Rule.Severity.fromString("warn"))
                .build();

        // Act
        Rule formalized = rule.withFormalizedCondition("Demographics.Age >= 18");

        // Assert
        assertFalse(rule.hasFormalizedCondition());
        assertEquals("Subject must be an adult", rule.effectiveCondition());
        assertTrue(formalized.hasFormalizedCondition());
        assertEquals("Demographics.Age >= 18", formalized.effectiveCondition());
        assertEquals(Rule.Severity.WARNING, formalized.severity());
        assertEquals(Rule.Severity.ERROR, Rule.Severity.fromString(null));
    }

    @Test
    void fieldValues_ShouldCoerceOrReturnNull() {
        // Assert
        assertEquals(Optional.of(new BigDecimal("12.5")), FieldValues.coerce(FieldType.NUMERIC, " 12.5 "));
        assertTrue(FieldValues.coerce(FieldType.NUMERIC, Double.NaN).isEmpty());
        assertTrue(FieldValues.coerce(FieldType.NUMERIC, "abc").isEmpty());
        assertEquals(Optional.of(LocalDate.parse("2024-03-01").toEpochDay()),
                FieldValues.coerce(FieldType.DATE, "2024-03-01T10:15:00"));
        assertEquals(Optional.of(3600L), FieldValues.coerce(FieldType.TIME, "01:00"));
        assertEquals(Optional.of(true), FieldValues.coerce(FieldType.BOOLEAN, "Yes"));
        assertTrue(FieldValues.coerce(FieldType.BOOLEAN, "maybe").isEmpty());
        assertEquals("2024-01-02", FieldValues.fromScale(FieldType.DATE, LocalDate.parse("2024-01-02").toEpochDay()));
    }

    @Test
    void testCase_ShouldTagDescriptionOnce() {
        // Arrange
        TestCase test = TestCase.builder()
                .ruleId("R1")
                .description("boundary")
                .expectedResult(false)
                .testData(Map.of("Labs", Map.of("Hb", 12)))
                .technique(Technique.ADVERSARIAL)
                .build();

        // Act
        TestCase tagged = test.tagged();

        // Assert
        assertEquals("[adversarial] boundary", tagged.description());
        assertSame(tagged, tagged.tagged());
        assertFalse(tagged.positive());
        assertEquals(Optional.of(12), tagged.value(new FieldRef("Labs", "Hb")));
        assertTrue(tagged.value(new FieldRef("Labs", "Plt")).isEmpty());
    }

    @Test
    void testCaseBuilder_ShouldDerivePositiveFromExpectedResult() {
        // Arrange
        TestData data = TestData.empty().put(new FieldRef("Labs", "Hb"), 14);

        // Act
        TestCase test = TestCase.builder()
                .ruleId("R1")
                .expectedResult(true)
                .testData(data)
                .technique(Technique.SYMBOLIC)
                .build();

        // Assert
        assertTrue(test.positive());
        assertEquals("", test.description());
        assertEquals(Optional.of(14), test.value(new FieldRef("Labs", "Hb")));
        assertFalse(TestCase.builder().ruleId("R1").technique(Technique.SYMBOLIC).build().positive());
    }

    @Test
    void validationResult_ShouldBeInvalidOnlyWithErrors() {
        // Arrange
        ValidationResult result = new ValidationResult("R1")
                .addWarning(IssueKind.TAUTOLOGY, "always true");

        // Assert
        assertTrue(result.isValid());
        result.addError(IssueKind.UNSATISFIABLE_RULE, "never true");
        assertFalse(result.isValid());
        assertTrue(result.hasWarning(IssueKind.TAUTOLOGY));
        assertFalse(result.hasError(IssueKind.TAUTOLOGY));
    }
}
