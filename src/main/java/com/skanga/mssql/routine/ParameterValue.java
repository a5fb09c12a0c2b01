package com.skanga.mssql.routine;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One decoded routine argument. The Java type of {@code value} is fixed by {@code kind}:
 * null, Integer, Long, BigDecimal, Double, Boolean, String or LocalDateTime.
 *
 * @param key   parameter name as supplied by the caller, e.g. {@code @amount}
 * @param kind  the value's classification
 * @param value the decoded value
 */
public record ParameterValue(String key, ValueKind kind, Object value) {
    public ParameterValue {
        if (kind == null) {
            throw new IllegalArgumentException("Value kind is required for parameter " + key);
        }
        Class<?> expectedType = switch (kind) {
            case NULL -> null;
            case INT32 -> Integer.class;
            case INT64 -> Long.class;
            case DECIMAL -> BigDecimal.class;
            case FLOAT64 -> Double.class;
            case BOOL -> Boolean.class;
            case TEXT -> String.class;
            case TEMPORAL -> LocalDateTime.class;
        };
        if (expectedType == null ? value != null : !expectedType.isInstance(value)) {
            throw new IllegalArgumentException(
                    "Parameter " + key + " of kind " + kind + " cannot hold " +
                    (value == null ? "null" : value.getClass().getSimpleName()));
        }
    }

    public static ParameterValue ofNull(String key) {
        return new ParameterValue(key, ValueKind.NULL, null);
    }

    public static ParameterValue ofInt(String key, int value) {
        return new ParameterValue(key, ValueKind.INT32, value);
    }

    public static ParameterValue ofLong(String key, long value) {
        return new ParameterValue(key, ValueKind.INT64, value);
    }

    public static ParameterValue ofDecimal(String key, BigDecimal value) {
        return new ParameterValue(key, ValueKind.DECIMAL, value);
    }

    public static ParameterValue ofDouble(String key, double value) {
        return new ParameterValue(key, ValueKind.FLOAT64, value);
    }

    public static ParameterValue ofBoolean(String key, boolean value) {
        return new ParameterValue(key, ValueKind.BOOL, value);
    }

    public static ParameterValue ofText(String key, String value) {
        return new ParameterValue(key, ValueKind.TEXT, value);
    }

    public static ParameterValue ofTemporal(String key, LocalDateTime value) {
        return new ParameterValue(key, ValueKind.TEMPORAL, value);
    }
}
