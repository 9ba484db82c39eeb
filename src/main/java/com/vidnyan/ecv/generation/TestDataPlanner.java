package com.vidnyan.ecv.generation;

import com.vidnyan.ecv.domain.condition.ComparisonOperator;
import com.vidnyan.ecv.domain.condition.Condition.Comparison;
import com.vidnyan.ecv.domain.condition.FieldRef;
import com.vidnyan.ecv.domain.condition.Literal;
import com.vidnyan.ecv.domain.condition.RuleAnalysis;
import com.vidnyan.ecv.domain.model.Field;
import com.vidnyan.ecv.domain.model.FieldType;
import com.vidnyan.ecv.domain.model.FieldValues;
import com.vidnyan.ecv.domain.model.TestData;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Chooses field values so that a rule's atomic comparisons hold, optionally with one
 * comparison deliberately violated. Treats the comparisons as a conjunction.
 */
public class TestDataPlanner {

    private final RuleAnalysis analysis;
    private final ValueSampler sampler;

    public TestDataPlanner(RuleAnalysis analysis, ValueSampler sampler) {
        this.analysis = analysis;
        this.sampler = sampler;
    }

    /**
     * Values satisfying every comparison.
     */
    public TestData satisfyingAll() {
        return plan(null);
    }

    /**
     * Values violating {@code violated} and satisfying the others where possible.
     */
    public TestData violating(Comparison violated) {
        return plan(violated);
    }

    private TestData plan(Comparison violated) {
        Map<FieldRef, Object> values = new LinkedHashMap<>();
        Set<FieldRef> missing = new HashSet<>();

        if (violated != null) {
            assign(violated, false, values, missing);
        }
        for (Comparison c : analysis.comparisons()) {
            if (c != violated) {
                assign(c, true, values, missing);
            }
        }

        TestData data = TestData.empty();
        for (FieldRef ref : analysis.fieldRefs()) {
            if (missing.contains(ref) && !values.containsKey(ref)) {
                data.remove(ref);
            } else {
                data.put(ref, values.computeIfAbsent(ref, this::defaultValue));
            }
        }
        return data;
    }

    private void assign(Comparison c, boolean satisfy, Map<FieldRef, Object> values, Set<FieldRef> missing) {
        if (c.isFieldToLiteral()) {
            FieldRef ref = (FieldRef) c.left();
            Literal literal = (Literal) c.right();
            if (values.containsKey(ref) || missing.contains(ref)) {
                return;
            }
            if (literal.isNull()) {
                // IS NULL holds when the field is absent
                boolean absent = (c.operator() == ComparisonOperator.EQ) == satisfy;
                if (absent) {
                    missing.add(ref);
                } else {
                    values.put(ref, defaultValue(ref));
                }
                return;
            }
            if (satisfy) {
                satisfyingValue(ref).ifPresent(v -> values.put(ref, v));
            } else {
                literalValue(ref, c.operator(), literal, false).ifPresent(v -> values.put(ref, v));
            }
        } else if (c.isFieldToField()) {
            FieldRef left = (FieldRef) c.left();
            FieldRef right = (FieldRef) c.right();
            boolean hasLeft = values.containsKey(left);
            boolean hasRight = values.containsKey(right);
            if (!hasLeft && !hasRight) {
                values.put(left, defaultValue(left));
                hasLeft = true;
            }
            if (hasLeft && !hasRight) {
                relativeValue(right, c.operator().converse(), left, values.get(left), satisfy)
                        .ifPresent(v -> values.put(right, v));
            } else if (hasRight && !hasLeft) {
                relativeValue(left, c.operator(), right, values.get(right), satisfy)
                        .ifPresent(v -> values.put(left, v));
            }
        }
    }

    /**
     * A value meeting every satisfied literal comparison on the field at once.
     */
    private Optional<Object> satisfyingValue(FieldRef ref) {
        FieldType type = analysis.typeOf(ref);
        List<Comparison> constraints = new ArrayList<>();
        for (Comparison c : analysis.literalComparisons()) {
            if (c.left().equals(ref)) {
                constraints.add(c);
            }
        }
        if (!type.isOrdered() || constraints.size() == 1) {
            Comparison first = constraints.get(0);
            return literalValue(ref, first.operator(), (Literal) first.right(), true);
        }

        Double low = null;
        Double high = null;
        Double exact = null;
        List<Double> excluded = new ArrayList<>();
        for (Comparison c : constraints) {
            Optional<Double> t = FieldValues.toScale(type, ((Literal) c.right()).value());
            if (t.isEmpty()) {
                continue;
            }
            double threshold = t.get();
            switch (c.operator()) {
                case GT, GE -> low = low == null ? threshold : Math.max(low, threshold);
                case LT, LE -> high = high == null ? threshold : Math.min(high, threshold);
                case EQ -> exact = threshold;
                case NE -> excluded.add(threshold);
            }
        }
        double value;
        if (exact != null) {
            value = exact;
        } else if (low != null && high != null) {
            value = type.isOrdered() && type != FieldType.NUMERIC
                    ? Math.floor((low + high) / 2)
                    : (low + high) / 2;
        } else if (low != null) {
            value = sampler.satisfying(type, ComparisonOperator.GT, low);
        } else if (high != null) {
            value = sampler.satisfying(type, ComparisonOperator.LT, high);
        } else {
            value = sampler.defaultScale(type, analysis.field(ref).orElse(null));
        }
        while (excluded.contains(value)) {
            value += type == FieldType.NUMERIC ? 1.5 : 1;
        }
        return Optional.of(FieldValues.fromScale(type, value));
    }

    /**
     * Value for {@code field op literal}, satisfied or violated.
     */
    public Optional<Object> literalValue(FieldRef ref, ComparisonOperator op, Literal literal, boolean satisfy) {
        FieldType type = analysis.typeOf(ref);
        Field field = analysis.field(ref).orElse(null);
        if (type.isOrdered()) {
            return FieldValues.toScale(type, literal.value())
                    .map(t -> FieldValues.fromScale(type,
                            satisfy ? sampler.satisfying(type, op, t) : sampler.violating(type, op, t)));
        }
        if (type == FieldType.BOOLEAN) {
            Optional<Boolean> b = FieldValues.toBoolean(literal.value());
            boolean equal = (op == ComparisonOperator.EQ) == satisfy;
            return b.map(v -> equal ? v : !v);
        }
        if (op.isOrdering()) {
            return Optional.empty();
        }
        String text = String.valueOf(literal.value());
        boolean equal = (op == ComparisonOperator.EQ) == satisfy;
        return Optional.of(equal ? text : sampler.otherCategory(text, field));
    }

    /**
     * Value for {@code target} such that {@code target op other} holds (or fails).
     */
    private Optional<Object> relativeValue(FieldRef target, ComparisonOperator op,
                                           FieldRef other, Object otherValue, boolean satisfy) {
        FieldType type = analysis.typeOf(target);
        FieldType otherType = analysis.typeOf(other);
        if (type.isOrdered() && otherType.isOrdered()) {
            return FieldValues.toScale(otherType, otherValue)
                    .map(t -> FieldValues.fromScale(type,
                            satisfy ? sampler.satisfying(type, op, t) : sampler.violating(type, op, t)));
        }
        if (op.isOrdering() || otherValue == null) {
            return Optional.empty();
        }
        boolean equal = (op == ComparisonOperator.EQ) == satisfy;
        if (type == FieldType.BOOLEAN) {
            return FieldValues.toBoolean(otherValue).map(v -> equal ? v : !v);
        }
        String text = otherValue.toString();
        return Optional.of(equal ? text : sampler.otherCategory(text, analysis.field(target).orElse(null)));
    }

    /**
     * Plausible value for a field the comparisons leave unconstrained.
     */
    public Object defaultValue(FieldRef ref) {
        return sampler.defaultValue(analysis.typeOf(ref), analysis.field(ref).orElse(null));
    }
}
