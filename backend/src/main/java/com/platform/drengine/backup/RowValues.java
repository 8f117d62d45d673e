package com.platform.drengine.backup;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Date;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.temporal.TemporalAccessor;
import java.util.Base64;
import java.util.Map;
import java.util.TreeMap;

/**
 * Normalizes JDBC column values into JSON-stable forms, so a row read at backup time and
 * the same row read back after a restore compare equal.
 */
public final class RowValues {

    private RowValues() {
    }

    public static Object normalize(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof BigDecimal decimal) {
            return canonicalNumber(decimal);
        }
        if (value instanceof BigInteger || value instanceof Long || value instanceof Integer
            || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Number number) {
            return canonicalNumber(BigDecimal.valueOf(number.doubleValue()));
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toInstant().toString();
        }
        if (value instanceof Date || value instanceof Time) {
            return value.toString();
        }
        if (value instanceof TemporalAccessor) {
            return value.toString();
        }
        if (value instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        return value.toString();
    }

    /**
     * Sorted copy of the row with every value in its canonical string form.
     */
    public static Map<String, String> canonical(Map<String, Object> row) {
        Map<String, String> canonical = new TreeMap<>();
        row.forEach((column, value) -> {
            Object normalized = normalize(value);
            canonical.put(column.toLowerCase(), normalized == null ? null : normalized.toString());
        });
        return canonical;
    }

    private static Object canonicalNumber(BigDecimal decimal) {
        BigDecimal stripped = decimal.stripTrailingZeros();
        if (stripped.scale() <= 0) {
            try {
                return stripped.longValueExact();
            } catch (ArithmeticException e) {
                return stripped.toPlainString();
            }
        }
        return stripped.toPlainString();
    }
}
