package com.vidnyan.ecv.generation;

import com.vidnyan.ecv.domain.condition.ComparisonOperator;
import com.vidnyan.ecv.domain.model.Field;
import com.vidnyan.ecv.domain.model.FieldType;
import com.vidnyan.ecv.domain.model.FieldValues;

import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Type-aware random values for generated test data.
 * Ordered types work on the solver scale: plain numbers, epoch days, seconds of day.
 * One instance per task; not thread-safe.
 */
public final class ValueSampler {

    private static final int SECONDS_PER_MINUTE = 60;

    private final Random random;

    public ValueSampler(Random random) {
        this.random = random;
    }

    /**
     * Sampler with a fixed seed, or a fresh random seed when {@code seed} is null.
     */
    public static ValueSampler create(Long seed) {
        return new ValueSampler(seed != null ? new Random(seed) : new Random());
    }

    public double uniform(double low, double high) {
        return low + random.nextDouble() * (high - low);
    }

    public int integer(int low, int highInclusive) {
        return low + random.nextInt(highInclusive - low + 1);
    }

    public <T> T pick(List<T> options) {
        return options.get(random.nextInt(options.size()));
    }

    /**
     * Scale value {@code x} with {@code x op threshold} true.
     */
    public double satisfying(FieldType type, ComparisonOperator op, double threshold) {
        return switch (op) {
            case GT -> threshold + delta(type, 1, 10);
            case GE -> threshold + delta(type, 0, 10);
            case LT -> threshold - delta(type, 1, 10);
            case LE -> threshold - delta(type, 0, 10);
            case EQ -> threshold;
            case NE -> threshold + sign() * delta(type, 1, 10);
        };
    }

    /**
     * Scale value {@code x} with {@code x op threshold} false.
     */
    public double violating(FieldType type, ComparisonOperator op, double threshold) {
        return switch (op) {
            case GT -> threshold - delta(type, 0, 5);
            case GE -> threshold - delta(type, 1, 5);
            case LT -> threshold + delta(type, 0, 5);
            case LE -> threshold + delta(type, 1, 5);
            case EQ -> threshold + sign() * delta(type, 1, 5);
            case NE -> threshold;
        };
    }

    /**
     * Non-negative offset in [min, max]: whole days, whole minutes, or a number rounded to
     * hundredths that never drops below {@code min}.
     */
    private double delta(FieldType type, int min, int max) {
        if (type.isDateLike()) {
            return integer(min, max);
        }
        if (type == FieldType.TIME) {
            return (double) integer(min, max) * SECONDS_PER_MINUTE;
        }
        double d = Math.floor(uniform(min, max) * 100) / 100.0;
        return Math.max(d, min);
    }

    private int sign() {
        return random.nextBoolean() ? 1 : -1;
    }

    /**
     * Plausible scale value for an ordered field, inside its declared bounds when present.
     */
    public double defaultScale(FieldType type, Field field) {
        Optional<Double> low = field == null ? Optional.empty() : field.lowerBound();
        Optional<Double> high = field == null ? Optional.empty() : field.upperBound();
        if (low.isPresent() && high.isPresent()) {
            double value = low.get() + (high.get() - low.get()) * uniform(0.25, 0.75);
            return type == FieldType.NUMERIC ? Math.round(value * 100) / 100.0 : Math.round(value);
        }
        return switch (type) {
            case DATE, DATETIME -> FieldValues.REFERENCE_DATE.toEpochDay() + integer(0, 365);
            case TIME -> (double) integer(8, 17) * 3600;
            default -> Math.round(uniform(10, 50) * 100) / 100.0;
        };
    }

    /**
     * Plausible test-data value for any field type.
     */
    public Object defaultValue(FieldType type, Field field) {
        if (type.isOrdered()) {
            return FieldValues.fromScale(type, defaultScale(type, field));
        }
        return switch (type) {
            case BOOLEAN -> random.nextBoolean();
            case CATEGORICAL -> field != null && field.hasValidValues() ? pick(field.validValues()) : "A";
            default -> "Sample text";
        };
    }

    /**
     * A category different from {@code value}: another valid value when one exists.
     */
    public String otherCategory(String value, Field field) {
        if (field != null) {
            List<String> others = field.validValues().stream()
                    .filter(v -> !v.equals(value))
                    .toList();
            if (!others.isEmpty()) {
                return pick(others);
            }
        }
        return value + "_other";
    }
}
