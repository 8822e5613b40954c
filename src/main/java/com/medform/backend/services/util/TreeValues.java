package com.medform.backend.services.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the loosely typed key/value trees produced by extraction
 * (String, Number, Boolean, Map, List leaves, as Jackson reads them).
 */
public final class TreeValues {

    private TreeValues() {
    }

    /**
     * Deep mutable copy. Maps keep insertion order.
     */
    @SuppressWarnings("unchecked")
    public static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), deepCopy(v)));
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) copy.add(deepCopy(item));
            return copy;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> deepCopyMap(Map<String, ?> map) {
        if (map == null) return new LinkedHashMap<>();
        return (Map<String, Object>) deepCopy(map);
    }

    /**
     * Deep read-only copy. Nulls inside maps and lists are kept.
     */
    public static Object immutableCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), immutableCopy(v)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) copy.add(immutableCopy(item));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> immutableCopyMap(Map<String, ?> map) {
        if (map == null) return null;
        return (Map<String, Object>) immutableCopy(map);
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(Object value) {
        return value instanceof Map<?, ?> ? (Map<String, Object>) value : null;
    }

    /**
     * Python-like truthiness: null, false, 0, empty strings and empty containers are false.
     */
    public static boolean isTruthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Number n) return n.doubleValue() != 0d;
        if (value instanceof CharSequence s) return s.length() > 0;
        if (value instanceof Map<?, ?> m) return !m.isEmpty();
        if (value instanceof List<?> l) return !l.isEmpty();
        return true;
    }

    /**
     * Renders a leaf for display. Integral doubles print without the fraction ("170", not "170.0").
     */
    public static String display(Object value) {
        if (value == null) return "";
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d)) {
                return Long.toString((long) d);
            }
        }
        return String.valueOf(value);
    }
}
