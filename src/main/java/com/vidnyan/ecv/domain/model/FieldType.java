package com.vidnyan.ecv.domain.model;

import java.util.Locale;

/**
 * Semantic type of a case-report-form field.
 */
public enum FieldType {
    NUMERIC("numeric"),
    DATE("date"),
    DATETIME("datetime"),
    TIME("time"),
    CATEGORICAL("categorical"),
    BOOLEAN("boolean"),
    TEXT("text");

    private final String code;

    FieldType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Day-granular temporal types, solved as days since epoch.
     */
    public boolean isDateLike() {
        return this == DATE || this == DATETIME;
    }

    public boolean isTemporal() {
        return isDateLike() || this == TIME;
    }

    /**
     * Types whose values are ordered on a numeric scale (numbers, dates, times).
     */
    public boolean isOrdered() {
        return this == NUMERIC || isTemporal();
    }

    public boolean isStringLike() {
        return this == CATEGORICAL || this == TEXT;
    }

    /**
     * Lenient mapping of the type names found in study specifications.
     * Unknown names fall back to {@link #TEXT}.
     */
    public static FieldType fromString(String value) {
        if (value == null) {
            return TEXT;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "number", "numeric", "integer", "int", "float", "decimal" -> NUMERIC;
            case "date" -> DATE;
            case "datetime", "timestamp" -> DATETIME;
            case "time" -> TIME;
            case "categorical", "category", "select", "radio", "list", "dropdown" -> CATEGORICAL;
            case "boolean", "bool", "checkbox", "yes/no" -> BOOLEAN;
            default -> TEXT;
        };
    }
}
