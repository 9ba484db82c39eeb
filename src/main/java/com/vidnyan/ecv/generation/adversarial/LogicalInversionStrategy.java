package com.vidnyan.ecv.generation.adversarial;

import com.vidnyan.ecv.domain.condition.ComparisonOperator;
import com.vidnyan.ecv.domain.condition.Condition.Comparison;
import com.vidnyan.ecv.domain.condition.FieldRef;
import com.vidnyan.ecv.domain.condition.Literal;
import com.vidnyan.ecv.domain.condition.RuleAnalysis;
import com.vidnyan.ecv.domain.model.Field;
import com.vidnyan.ecv.domain.model.FieldType;
import com.vidnyan.ecv.domain.model.FieldValues;
import com.vidnyan.ecv.domain.model.TestCase;
import com.vidnyan.ecv.domain.model.TestData;
import com.vidnyan.ecv.generation.TestDataPlanner;
import com.vidnyan.ecv.generation.ValueSampler;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Pushes each compared field to the other side of its comparison.
 * <p>
 * Only {@code !=} gets a computed expectation; every other case is recorded as false and left
 * for the multi-modal verifier to confirm or discard.
 */
@Component
public class LogicalInversionStrategy implements AdversarialStrategy {

    @Override
    public String name() {
        return "logical-inversion";
    }

    @Override
    public List<TestCase> generate(RuleAnalysis analysis, TestDataPlanner planner, ValueSampler sampler) {
        TestData base = planner.satisfyingAll();
        List<TestCase> tests = new ArrayList<>();
        for (Comparison c : analysis.literalComparisons()) {
            FieldRef ref = (FieldRef) c.left();
            Literal literal = (Literal) c.right();
            FieldType type = analysis.typeOf(ref);

            Optional<Object> inverted = Optional.empty();
            if (type.isOrdered()) {
                inverted = FieldValues.toScale(type, literal.value())
                        .map(t -> FieldValues.fromScale(type, t + opposite(c.operator())));
            } else if (type == FieldType.CATEGORICAL) {
                Field field = analysis.field(ref).orElse(null);
                if (field != null && field.hasValidValues()) {
                    inverted = Optional.of(sampler.otherCategory(String.valueOf(literal.value()), field));
                }
            }
            if (inverted.isEmpty()) {
                continue;
            }
            boolean expected = c.operator() == ComparisonOperator.NE;
            Object value = inverted.get();
            tests.add(testCase(analysis, base.copy().put(ref, value), expected,
                    "Logical inversion: " + ref + " = " + value + " against " + c));
        }
        return tests;
    }

    /**
     * One unit against the operator's direction.
     */
    private static int opposite(ComparisonOperator op) {
        return switch (op) {
            case GT, GE -> -1;
            default -> 1;
        };
    }
}
