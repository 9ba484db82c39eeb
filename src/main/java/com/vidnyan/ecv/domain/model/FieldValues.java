package com.vidnyan.ecv.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

/**
 * Coercion of raw test-data values to the canonical value of a field type.
 * <p>
 * Canonical values: {@link BigDecimal} for numeric, {@code Long} epoch days for date and datetime,
 * {@code Long} seconds of day for time, {@link Boolean} for boolean and {@link String} for
 * categorical and text. A value that cannot be coerced is NULL (empty optional), so every
 * evaluator of a condition sees the same value for the same raw input.
 */
public final class FieldValues {

    /** Anchor date for generated temporal values. */
    public static final LocalDate REFERENCE_DATE = LocalDate.of(2024, 1, 1);

    private static final int SECONDS_PER_DAY = 86_400;

    private FieldValues() {
    }

    /**
     * Canonical value of {@code raw} for the given type, or empty when it is NULL or not coercible.
     */
    public static Optional<Object> coerce(FieldType type, Object raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return switch (type) {
            case NUMERIC -> toDecimal(raw).map(Object.class::cast);
            case DATE, DATETIME -> toEpochDay(raw).map(Object.class::cast);
            case TIME -> toSecondOfDay(raw).map(Object.class::cast);
            case BOOLEAN -> toBoolean(raw).map(Object.class::cast);
            case CATEGORICAL, TEXT -> Optional.of(toText(raw));
        };
    }

    /**
     * Value on the numeric solver scale of an ordered type.
     */
    public static Optional<Double> toScale(FieldType type, Object raw) {
        if (!type.isOrdered()) {
            return Optional.empty();
        }
        return coerce(type, raw).map(v -> v instanceof BigDecimal d ? d.doubleValue() : ((Long) v).doubleValue());
    }

    /**
     * Render a solver-scale value back to a test-data value.
     */
    public static Object fromScale(FieldType type, double value) {
        return switch (type) {
            case DATE, DATETIME -> LocalDate.ofEpochDay(Math.round(value)).toString();
            case TIME -> LocalTime.ofSecondOfDay(Math.floorMod(Math.round(value), SECONDS_PER_DAY)).toString();
            default -> value;
        };
    }

    public static Optional<BigDecimal> toDecimal(Object raw) {
        if (raw instanceof BigDecimal d) {
            return Optional.of(d);
        }
        if (raw instanceof Number n) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return Optional.empty();
            }
            return Optional.of(n instanceof Double || n instanceof Float
                    ? BigDecimal.valueOf(d)
                    : new BigDecimal(n.toString()));
        }
        if (raw instanceof String s) {
            try {
                return Optional.of(new BigDecimal(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public static Optional<Long> toEpochDay(Object raw) {
        if (raw instanceof LocalDate d) {
            return Optional.of(d.toEpochDay());
        }
        if (raw instanceof LocalDateTime dt) {
            return Optional.of(dt.toLocalDate().toEpochDay());
        }
        if (raw instanceof String s) {
            String text = s.trim();
            if (text.length() > 10 && (text.charAt(10) == 'T' || text.charAt(10) == ' ')) {
                text = text.substring(0, 10);
            }
            try {
                return Optional.of(LocalDate.parse(text).toEpochDay());
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public static Optional<Long> toSecondOfDay(Object raw) {
        if (raw instanceof LocalTime t) {
            return Optional.of((long) t.toSecondOfDay());
        }
        if (raw instanceof String s) {
            try {
                return Optional.of((long) LocalTime.parse(s.trim()).toSecondOfDay());
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public static Optional<Boolean> toBoolean(Object raw) {
        if (raw instanceof Boolean b) {
            return Optional.of(b);
        }
        if (raw instanceof Number n && (n.intValue() == 0 || n.intValue() == 1)
                && n.doubleValue() == n.intValue()) {
            return Optional.of(n.intValue() == 1);
        }
        if (raw instanceof String s) {
            return switch (s.trim().toLowerCase(Locale.ROOT)) {
                case "true", "yes", "y", "1" -> Optional.of(true);
                case "false", "no", "n", "0" -> Optional.of(false);
                default -> Optional.empty();
            };
        }
        return Optional.empty();
    }

    private static String toText(Object raw) {
        if (raw instanceof BigDecimal d) {
            return d.stripTrailingZeros().toPlainString();
        }
        return raw.toString();
    }
}
