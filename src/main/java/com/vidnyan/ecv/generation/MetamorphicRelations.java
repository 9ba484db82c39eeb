package com.vidnyan.ecv.generation;

import com.vidnyan.ecv.domain.condition.ComparisonOperator;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Operator-indexed metamorphic relations.
 * <p>
 * Each entry states the truth of {@code x' op t} after perturbing {@code x}, given that
 * {@code x op t} held before. The margin {@code m} is {@code |x - t|}.
 */
public final class MetamorphicRelations {

    private static final Map<ComparisonOperator, List<Entry>> TABLE = new EnumMap<>(ComparisonOperator.class);

    static {
        TABLE.put(ComparisonOperator.GT, List.of(
                new Entry(Relation.INCREASE, true),
                new Entry(Relation.DECREASE_WITHIN, true),
                new Entry(Relation.DECREASE_BEYOND, false)));
        TABLE.put(ComparisonOperator.GE, List.of(
                new Entry(Relation.INCREASE, true),
                new Entry(Relation.DECREASE_WITHIN, true),
                new Entry(Relation.DECREASE_BEYOND, false)));
        TABLE.put(ComparisonOperator.LT, List.of(
                new Entry(Relation.DECREASE, true),
                new Entry(Relation.INCREASE_WITHIN, true),
                new Entry(Relation.INCREASE_BEYOND, false)));
        TABLE.put(ComparisonOperator.LE, List.of(
                new Entry(Relation.DECREASE, true),
                new Entry(Relation.INCREASE_WITHIN, true),
                new Entry(Relation.INCREASE_BEYOND, false)));
        TABLE.put(ComparisonOperator.EQ, List.of(
                new Entry(Relation.EXACT_MATCH, true),
                new Entry(Relation.SLIGHT_CHANGE, false)));
        TABLE.put(ComparisonOperator.NE, List.of(
                new Entry(Relation.ANY_CHANGE, true),
                new Entry(Relation.EXACT_MATCH, false)));
    }

    private MetamorphicRelations() {
    }

    public static List<Entry> forOperator(ComparisonOperator operator) {
        return TABLE.get(operator);
    }

    public record Entry(Relation relation, boolean expectedResult) {}

    /**
     * Perturbations of a base value relative to a threshold.
     */
    public enum Relation {
        INCREASE("increase"),
        DECREASE("decrease"),
        INCREASE_WITHIN("increase_within"),
        DECREASE_WITHIN("decrease_within"),
        INCREASE_BEYOND("increase_beyond"),
        DECREASE_BEYOND("decrease_beyond"),
        EXACT_MATCH("exact_match"),
        SLIGHT_CHANGE("slight_change"),
        ANY_CHANGE("any_change");

        private final String code;

        Relation(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }

        /**
         * Follow-up value. With {@code wholeUnits} every offset is a whole number (days, seconds).
         */
        public double apply(double base, double threshold, boolean wholeUnits) {
            double margin = Math.abs(base - threshold);
            double step = wholeUnits ? Math.floor(margin / 2) + 1 : margin * 0.5 + 1;
            double within = wholeUnits ? Math.floor(margin / 2) : margin * 0.5;
            double beyond = wholeUnits ? Math.ceil(margin * 1.5) + 1 : margin * 1.5 + 1;
            return switch (this) {
                case INCREASE -> base + step;
                case DECREASE -> base - step;
                case INCREASE_WITHIN -> base + within;
                case DECREASE_WITHIN -> base - within;
                case INCREASE_BEYOND -> base + beyond;
                case DECREASE_BEYOND -> base - beyond;
                case EXACT_MATCH -> threshold;
                case SLIGHT_CHANGE -> threshold + (wholeUnits ? 1 : 0.1);
                case ANY_CHANGE -> base + (base >= threshold ? step : -step);
            };
        }
    }
}
