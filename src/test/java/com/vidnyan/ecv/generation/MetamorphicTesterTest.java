package com.vidnyan.ecv.generation;

import com.vidnyan.ecv.config.EcvProperties;
import com.vidnyan.ecv.domain.condition.ConditionModel;
import com.vidnyan.ecv.domain.condition.FieldRef;
import com.vidnyan.ecv.domain.model.Field;
import com.vidnyan.ecv.domain.model.FieldType;
import com.vidnyan.ecv.domain.model.FieldValues;
import com.vidnyan.ecv.domain.model.Form;
import com.vidnyan.ecv.domain.model.Rule;
import com.vidnyan.ecv.domain.model.Specification;
import com.vidnyan.ecv.domain.model.TestCase;
import com.vidnyan.ecv.domain.model.Technique;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MetamorphicTesterTest {

    private static final FieldRef HB = new FieldRef("Labs", "Hb");
    private static final FieldRef VISIT_DATE = new FieldRef("Visit", "VisitDate");

    private final Specification specification = Specification.of(
            Form.of("Labs", Field.of("Hb", FieldType.NUMERIC)),
            Form.of("Visit", Field.of("VisitDate", FieldType.DATE)));

    private MetamorphicTester tester;

    @BeforeEach
    void setUp() {
        EcvProperties properties = new EcvProperties();
        properties.getGeneration().setSeed(42L);
        tester = new MetamorphicTester(new ConditionModel(), properties);
    }

    @Test
    void generate_ShouldProduceBaseCasesAndFollowUps() {
        // Arrange
        Rule rule = Rule.formalized("HB-001", "Labs.Hb >= 12");

        // Act
        List<TestCase> tests = tester.generate(rule, specification);

        // Assert
        assertEquals(5, tests.size());
        assertTrue(tests.get(0).expectedResult());
        assertFalse(tests.get(1).expectedResult());
        assertTrue(tests.stream().allMatch(t -> t.technique() == Technique.METAMORPHIC));
        assertTrue(hb(tests.get(1)) < 12);

        TestCase beyond = tests.stream()
                .filter(t -> t.description().startsWith("Metamorphic decrease_beyond"))
                .findFirst().orElseThrow();
        assertFalse(beyond.expectedResult());
        assertTrue(hb(beyond) < 12);

        TestCase within = tests.stream()
                .filter(t -> t.description().startsWith("Metamorphic decrease_within"))
                .findFirst().orElseThrow();
        assertTrue(within.expectedResult());
        assertTrue(hb(within) >= 12);
    }

    @Test
    void generate_ShouldKeepDateFollowUpsOnWholeDays() {
        // Arrange
        Rule rule = Rule.formalized("VIS-001", "Visit.VisitDate > '2024-03-01'");
        LocalDate threshold = LocalDate.parse("2024-03-01");

        // Act
        List<TestCase> followUps = tester.generate(rule, specification).stream()
                .filter(t -> !t.description().startsWith("Metamorphic base"))
                .toList();

        // Assert
        assertEquals(3, followUps.size());
        for (TestCase test : followUps) {
            LocalDate date = LocalDate.parse((String) test.value(VISIT_DATE).orElseThrow());
            assertEquals(test.expectedResult(), date.isAfter(threshold), test.description());
        }
    }

    @Test
    void generate_ShouldSkipRuleWithoutComparisons() {
        // Act
        List<TestCase> tests = tester.generate(Rule.builder().id("FREE").condition("check it").build(), specification);

        // Assert
        assertTrue(tests.isEmpty());
    }

    private static double hb(TestCase test) {
        return test.value(HB).flatMap(FieldValues::toDecimal).orElseThrow().doubleValue();
    }
}
