package com.vidnyan.ecv.generation.adversarial;

import com.vidnyan.ecv.domain.condition.ComparisonOperator;
import com.vidnyan.ecv.domain.condition.Condition.Comparison;
import com.vidnyan.ecv.domain.condition.FieldRef;
import com.vidnyan.ecv.domain.condition.Literal;
import com.vidnyan.ecv.domain.condition.RuleAnalysis;
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
 * A value exactly at each literal threshold and one just past it.
 */
@Component
public class BoundaryValueStrategy implements AdversarialStrategy {

    private static final double NUMERIC_STEP = 0.001;
    private static final double TIME_STEP = 60;

    @Override
    public String name() {
        return "boundary";
    }

    @Override
    public List<TestCase> generate(RuleAnalysis analysis, TestDataPlanner planner, ValueSampler sampler) {
        TestData base = planner.satisfyingAll();
        List<TestCase> tests = new ArrayList<>();
        for (Comparison c : analysis.literalComparisons()) {
            FieldRef ref = (FieldRef) c.left();
            FieldType type = analysis.typeOf(ref);
            if (!type.isOrdered()) {
                continue;
            }
            Optional<Double> threshold = FieldValues.toScale(type, ((Literal) c.right()).value());
            if (threshold.isEmpty()) {
                continue;
            }
            double t = threshold.get();
            ComparisonOperator op = c.operator();

            Object at = FieldValues.fromScale(type, t);
            tests.add(testCase(analysis, base.copy().put(ref, at), op.test(t, t),
                    "Boundary: " + ref + " = " + at + " exactly at threshold of " + c));

            double past = t + direction(op) * step(type);
            Object beyond = FieldValues.fromScale(type, past);
            tests.add(testCase(analysis, base.copy().put(ref, beyond), op.test(past, t),
                    "Boundary: " + ref + " = " + beyond + " just past threshold of " + c));
        }
        return tests;
    }

    /**
     * Direction that leaves the satisfying side of the operator.
     */
    private static int direction(ComparisonOperator op) {
        return switch (op) {
            case GT, GE -> -1;
            default -> 1;
        };
    }

    private static double step(FieldType type) {
        if (type.isDateLike()) {
            return 1;
        }
        return type == FieldType.TIME ? TIME_STEP : NUMERIC_STEP;
    }
}
