package com.vidnyan.ecv.verification;

import com.vidnyan.ecv.config.EcvProperties;
import com.vidnyan.ecv.domain.condition.ConditionModel;
import com.vidnyan.ecv.domain.model.Field;
import com.vidnyan.ecv.domain.model.FieldType;
import com.vidnyan.ecv.domain.model.Form;
import com.vidnyan.ecv.domain.model.Rule;
import com.vidnyan.ecv.domain.model.Specification;
import com.vidnyan.ecv.domain.model.TestCase;
import com.vidnyan.ecv.domain.model.Technique;
import com.vidnyan.ecv.smt.SmtVerifier;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MultiModalVerifierTest {

    private final ConditionModel conditionModel = new ConditionModel();
    private final SmtVerifier smtVerifier = new SmtVerifier(conditionModel, new EcvProperties());
    private final SafeConditionEvaluator evaluator = new SafeConditionEvaluator();

    private final Specification specification = Specification.of(
            Form.of("Labs", Field.of("Hb", FieldType.NUMERIC)));

    private final Rule over12 = Rule.formalized("HB-12", "Labs.Hb > 12");
    private final Rule over20 = Rule.formalized("HB-20", "Labs.Hb > 20");

    @Test
    void verify_ShouldDiscardMislabelledCases() {
        // Arrange
        MultiModalVerifier verifier = new MultiModalVerifier(conditionModel, List.of(
                new SmtRecheckMode(smtVerifier),
                new DirectEvaluationMode(evaluator),
                new CrossRuleValidationMode(smtVerifier, evaluator)));
        TestCase wrong = testCase("HB-12", "wrong", true, 5);
        TestCase right = testCase("HB-12", "right", true, 20);
        TestCase negative = testCase("HB-12", "negative", false, 3);

        // Act
        List<TestCase> verified = verifier.verify(over12, specification,
                List.of(wrong, right, negative), List.of(over12));

        // Assert
        assertEquals(List.of(right, negative), verified);
    }

    @Test
    void verify_ShouldDiscardMislabelledMembershipCase() {
        // Arrange
        Specification demographics = Specification.of(Form.of("Demo",
                Field.builder().name("Sex").type(FieldType.CATEGORICAL).validValues(List.of("M", "F")).build()));
        Rule knownSex = Rule.formalized("SEX-01", "Demo.Sex IN ('M', 'F')");
        SmtRecheckMode smtMode = new SmtRecheckMode(smtVerifier);
        DirectEvaluationMode directMode = new DirectEvaluationMode(evaluator);
        MultiModalVerifier verifier = new MultiModalVerifier(conditionModel, List.of(smtMode, directMode));
        TestCase wrong = sexCase("wrong", true, "X");
        TestCase right = sexCase("right", true, "F");
        VerificationContext context = verifier.context(knownSex, demographics, List.of(knownSex));

        // Act
        List<TestCase> verified = verifier.verify(knownSex, demographics, List.of(wrong, right), List.of(knownSex));

        // Assert
        assertEquals(Optional.of(false), smtMode.opinion(context, wrong));
        assertEquals(Optional.of(false), directMode.opinion(context, wrong));
        assertEquals(Optional.of(true), directMode.opinion(context, right));
        assertEquals(List.of(right), verified);
    }

    @Test
    void isConfirmed_ShouldDiscardOnTieOrSilence() {
        // Arrange
        MultiModalVerifier silent = new MultiModalVerifier(conditionModel, List.of(
                stub("none", Optional.empty())));
        MultiModalVerifier split = new MultiModalVerifier(conditionModel, List.of(
                stub("yes", Optional.of(true)), stub("no", Optional.of(false))));
        MultiModalVerifier majority = new MultiModalVerifier(conditionModel, List.of(
                stub("yes", Optional.of(true)), stub("none", Optional.empty())));
        TestCase candidate = testCase("HB-12", "candidate", true, 20);

        // Act + Assert
        assertFalse(silent.isConfirmed(silent.context(over12, specification, List.of()), candidate));
        assertFalse(split.isConfirmed(split.context(over12, specification, List.of()), candidate));
        assertTrue(majority.isConfirmed(majority.context(over12, specification, List.of()), candidate));
    }

    @Test
    void isConfirmed_ShouldSkipFailingMode() {
        // Arrange
        VerificationMode broken = new VerificationMode() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public Optional<Boolean> opinion(VerificationContext context, TestCase testCase) {
                throw new IllegalStateException("boom");
            }
        };
        MultiModalVerifier verifier = new MultiModalVerifier(conditionModel,
                List.of(broken, new DirectEvaluationMode(evaluator)));
        TestCase candidate = testCase("HB-12", "candidate", true, 20);

        // Act
        boolean confirmed = verifier.isConfirmed(verifier.context(over12, specification, List.of()), candidate);

        // Assert
        assertTrue(confirmed);
    }

    @Test
    void crossRule_ShouldUseImpliedRelatedRules() {
        // Arrange
        CrossRuleValidationMode mode = new CrossRuleValidationMode(smtVerifier, evaluator);
        MultiModalVerifier verifier = new MultiModalVerifier(conditionModel, List.of(mode));
        VerificationContext forOver12 = verifier.context(over12, specification, List.of(over12, over20));
        VerificationContext forOver20 = verifier.context(over20, specification, List.of(over12, over20));

        // Act
        Optional<Boolean> contradicted = mode.opinion(forOver12, testCase("HB-12", "expects false", false, 25));
        Optional<Boolean> supported = mode.opinion(forOver20, testCase("HB-20", "expects true", true, 25));
        Optional<Boolean> noImplication = mode.opinion(forOver12, testCase("HB-12", "expects true", true, 15));

        // Assert
        assertEquals(1, forOver12.relatedRules().size());
        assertEquals(Optional.of(false), contradicted);
        assertEquals(Optional.of(true), supported);
        assertTrue(noImplication.isEmpty());
    }

    private static VerificationMode stub(String name, Optional<Boolean> opinion) {
        return new VerificationMode() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Optional<Boolean> opinion(VerificationContext context, TestCase testCase) {
                return opinion;
            }
        };
    }

    private static TestCase sexCase(String description, boolean expected, String sex) {
        return TestCase.builder()
                .ruleId("SEX-01")
                .description(description)
                .expectedResult(expected)
                .testData(Map.of("Demo", Map.of("Sex", sex)))
                .technique(Technique.SYMBOLIC)
                .build();
    }

    private static TestCase testCase(String ruleId, String description, boolean expected, double hb) {
        return TestCase.builder()
                .ruleId(ruleId)
                .description(description)
                .expectedResult(expected)
                .testData(Map.of("Labs", Map.of("Hb", hb)))
                .technique(Technique.SYMBOLIC)
                .build();
    }
}
