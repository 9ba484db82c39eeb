package com.vidnyan.ecv.generation.adversarial;

import com.vidnyan.ecv.application.port.out.MutationProposer;
import com.vidnyan.ecv.application.port.out.MutationProposer.ProposedScenario;
import com.vidnyan.ecv.config.EcvProperties;
import com.vidnyan.ecv.domain.condition.ConditionModel;
import com.vidnyan.ecv.domain.condition.FieldRef;
import com.vidnyan.ecv.domain.condition.RuleAnalysis;
import com.vidnyan.ecv.domain.model.Field;
import com.vidnyan.ecv.domain.model.FieldType;
import com.vidnyan.ecv.domain.model.FieldValues;
import com.vidnyan.ecv.domain.model.Form;
import com.vidnyan.ecv.domain.model.Rule;
import com.vidnyan.ecv.domain.model.Specification;
import com.vidnyan.ecv.domain.model.TestCase;
import com.vidnyan.ecv.domain.model.Technique;
import com.vidnyan.ecv.generation.TestDataPlanner;
import com.vidnyan.ecv.generation.ValueSampler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AdversarialTestGeneratorTest {

    private static final FieldRef HB = new FieldRef("Labs", "Hb");

    private final Specification specification = Specification.of(
            Form.of("Labs", Field.of("Hb", FieldType.NUMERIC)));

    private final Rule rule = Rule.formalized("HB-001", "Labs.Hb >= 12");

    private EcvProperties properties;

    @BeforeEach
    void setUp() {
        properties = new EcvProperties();
        properties.getGeneration().setSeed(42L);
    }

    @Test
    void generate_ShouldLabelBoundaryValuesByOperator() {
        // Arrange
        AdversarialTestGenerator generator = generator(List.of(new BoundaryValueStrategy()), noProposals());

        // Act
        List<TestCase> tests = generator.generate(rule, specification);

        // Assert
        assertEquals(2, tests.size());
        TestCase at = tests.get(0);
        TestCase past = tests.get(1);
        assertEquals(0, hb(at).compareTo(BigDecimal.valueOf(12)));
        assertTrue(at.expectedResult());
        assertEquals(0, hb(past).compareTo(new BigDecimal("11.999")));
        assertFalse(past.expectedResult());
        assertTrue(tests.stream().allMatch(t -> t.technique() == Technique.ADVERSARIAL));
    }

    @Test
    void generate_ShouldIsolateFailingStrategy() {
        // Arrange
        AdversarialStrategy broken = new AdversarialStrategy() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public List<TestCase> generate(RuleAnalysis analysis, TestDataPlanner planner, ValueSampler sampler) {
                throw new IllegalStateException("boom");
            }
        };
        AdversarialTestGenerator generator = generator(
                List.of(broken, new MissingValueStrategy()), noProposals());

        // Act
        List<TestCase> tests = generator.generate(rule, specification);

        // Assert
        assertEquals(1, tests.size());
        assertTrue(tests.get(0).description().startsWith("Missing value"));
        assertFalse(tests.get(0).expectedResult());
        assertTrue(tests.get(0).value(HB).isEmpty());
    }

    @Test
    void generate_ShouldTagProposedScenariosAsLlm() {
        // Arrange
        MutationProposer proposer = (r, s) -> List.of(
                new ProposedScenario("Hb far below range", false, Map.of("Labs", Map.of("Hb", 3))));
        AdversarialTestGenerator generator = generator(List.of(), proposer);

        // Act
        List<TestCase> tests = generator.generate(rule, specification);

        // Assert
        assertEquals(1, tests.size());
        TestCase proposed = tests.get(0);
        assertEquals(Technique.LLM, proposed.technique());
        assertEquals("HB-001", proposed.ruleId());
        assertFalse(proposed.expectedResult());
        assertEquals(3, proposed.value(HB).orElseThrow());
    }

    @Test
    void generate_ShouldSurviveFailingProposer() {
        // Arrange
        MutationProposer proposer = (r, s) -> {
            throw new IllegalStateException("provider down");
        };
        AdversarialTestGenerator generator = generator(
                List.of(new BoundaryValueStrategy(), new TypeConfusionStrategy()), proposer);

        // Act
        List<TestCase> tests = generator.generate(rule, specification);

        // Assert
        assertFalse(tests.isEmpty());
        assertTrue(tests.stream().noneMatch(t -> t.technique() == Technique.LLM));
        assertTrue(tests.stream().anyMatch(t -> "not_a_number".equals(t.value(HB).orElse(null))));
    }

    private AdversarialTestGenerator generator(List<AdversarialStrategy> strategies, MutationProposer proposer) {
        return new AdversarialTestGenerator(new ConditionModel(), properties, strategies, proposer);
    }

    private static MutationProposer noProposals() {
        return (r, s) -> List.of();
    }

    private static BigDecimal hb(TestCase test) {
        return test.value(HB).flatMap(FieldValues::toDecimal).orElseThrow();
    }
}
