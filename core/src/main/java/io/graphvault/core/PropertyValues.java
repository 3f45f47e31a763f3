// file: src/main/java/io/graphvault/core/PropertyValues.java
package io.graphvault.core;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Closed value domain for node and relationship properties.
 * <p>
 * Supported values mirror what a property-graph store can persist:
 *  - String
 *  - Long / Double (smaller integral and floating types are widened)
 *  - Boolean
 *  - java.time values: LocalDate, LocalTime, OffsetTime, LocalDateTime,
 *    OffsetDateTime, ZonedDateTime, Instant
 *  - List of any of the above (no nesting)
 * <p>
 * Maps and nested lists are rejected rather than flattened.
 */
public final class PropertyValues {

    private PropertyValues() {
        // utility
    }

    /**
     * Validate and copy a property map.
     * <p>
     * Null-valued entries are dropped; the store does not persist nulls.
     *
     * @return an unmodifiable, insertion-ordered copy with widened numbers
     * @throws UnsupportedPropertyException if any value is outside the domain
     */
    public static Map<String, Object> checked(Map<String, ?> properties) {
        if (properties == null || properties.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> out = new LinkedHashMap<>(properties.size() * 2);
        for (Map.Entry<String, ?> e : properties.entrySet()) {
            String key = e.getKey();
            if (key == null || key.isEmpty()) {
                throw new UnsupportedPropertyException("property key must not be empty");
            }
            Object value = e.getValue();
            if (value == null) {
                continue;
            }
            out.put(key, normalize(key, value));
        }
        return Collections.unmodifiableMap(out);
    }

    /** True if {@code value} is a supported scalar (not a list). */
    public static boolean isScalar(Object value) {
        return value instanceof String
                || value instanceof Boolean
                || value instanceof Long
                || value instanceof Integer
                || value instanceof Short
                || value instanceof Byte
                || value instanceof Double
                || value instanceof Float
                || isTemporal(value);
    }

    public static boolean isTemporal(Object value) {
        return value instanceof LocalDate
                || value instanceof LocalTime
                || value instanceof OffsetTime
                || value instanceof LocalDateTime
                || value instanceof OffsetDateTime
                || value instanceof ZonedDateTime
                || value instanceof Instant;
    }

    private static Object normalize(String key, Object value) {
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                if (item == null) {
                    throw new UnsupportedPropertyException("property '" + key + "' contains a null list element");
                }
                if (!isScalar(item)) {
                    throw unsupported(key, item);
                }
                copy.add(widen(item));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Object[] array) {
            return normalize(key, java.util.Arrays.asList(array));
        }
        if (!isScalar(value)) {
            throw unsupported(key, value);
        }
        return widen(value);
    }

    private static Object widen(Object scalar) {
        if (scalar instanceof Integer || scalar instanceof Short || scalar instanceof Byte) {
            return ((Number) scalar).longValue();
        }
        if (scalar instanceof Float f) {
            return f.doubleValue();
        }
        return scalar;
    }

    private static UnsupportedPropertyException unsupported(String key, Object value) {
        String kind = value instanceof Map<?, ?> ? "nested map"
                : value instanceof List<?> ? "nested list"
                : value.getClass().getSimpleName();
        return new UnsupportedPropertyException(
                "property '" + key + "' has unsupported value type: " + kind);
    }
}
