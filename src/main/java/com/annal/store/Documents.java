package com.annal.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Helpers for the plain {@code Map}/{@code List} trees that make up document bodies.
 */
public final class Documents {
    private Documents() {
    }

    public static Map<String, Object> deepCopy(Map<String, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (var entry : source.entrySet()) {
            copy.put(entry.getKey(), deepCopyValue(entry.getValue()));
        }
        return copy;
    }

    public static Object deepCopyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            for (var entry : map.entrySet()) {
                nested.put(String.valueOf(entry.getKey()), deepCopyValue(entry.getValue()));
            }
            return nested;
        }
        if (value instanceof Collection<?> list) {
            List<Object> nested = new ArrayList<>();
            for (Object o : list) {
                nested.add(deepCopyValue(o));
            }
            return nested;
        }
        return value;
    }

    /**
     * Reads a nested value using dot notation. Numeric segments index into lists.
     * Returns {@code null} when any segment is missing.
     */
    public static Object getPath(Map<String, ?> fields, String path) {
        if (fields == null || path == null) {
            return null;
        }
        Object current = fields;
        for (String p : path.split("\\.")) {
            if (current instanceof Map<?, ?> m) {
                current = m.get(p);
            } else if (current instanceof List<?> l) {
                int idx;
                try {
                    idx = Integer.parseInt(p);
                } catch (NumberFormatException e) {
                    return null;
                }
                if (idx < 0 || idx >= l.size()) return null;
                current = l.get(idx);
            } else {
                return null;
            }
        }
        return current;
    }

    /** Writes a value at a dotted path, creating intermediate maps as needed. */
    @SuppressWarnings("unchecked")
    public static void setPath(Map<String, Object> fields, String path, Object value) {
        String[] parts = path.split("\\.");
        Map<String, Object> current = fields;
        for (int i = 0; i < parts.length - 1; i++) {
            Object next = current.get(parts[i]);
            if (!(next instanceof Map)) {
                next = new LinkedHashMap<String, Object>();
                current.put(parts[i], next);
            }
            current = (Map<String, Object>) next;
        }
        current.put(parts[parts.length - 1], deepCopyValue(value));
    }

    /**
     * Structural equality that compares numbers by value, so {@code 1}, {@code 1L}
     * and {@code 1.0} are equal. Maps and lists are compared recursively.
     */
    public static boolean valuesEqual(Object a, Object b) {
        if (a == b) return true;
        if (a == null || b == null) return false;
        if (a instanceof Number x && b instanceof Number y) {
            if (isIntegral(x) && isIntegral(y)) {
                return x.longValue() == y.longValue();
            }
            return Double.compare(x.doubleValue(), y.doubleValue()) == 0;
        }
        if (a instanceof Map<?, ?> m1 && b instanceof Map<?, ?> m2) {
            if (m1.size() != m2.size()) return false;
            for (var entry : m1.entrySet()) {
                if (!m2.containsKey(entry.getKey())) return false;
                if (!valuesEqual(entry.getValue(), m2.get(entry.getKey()))) return false;
            }
            return true;
        }
        if (a instanceof Collection<?> c1 && b instanceof Collection<?> c2) {
            if (c1.size() != c2.size()) return false;
            Iterator<?> i1 = c1.iterator();
            Iterator<?> i2 = c2.iterator();
            while (i1.hasNext()) {
                if (!valuesEqual(i1.next(), i2.next())) return false;
            }
            return true;
        }
        return Objects.equals(a, b);
    }

    /**
     * Normalizes a value for ordering comparisons: numbers become doubles, other
     * comparables are returned as is and anything else yields {@code null}.
     */
    @SuppressWarnings("rawtypes")
    public static Comparable normalizeComparable(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof Comparable<?> comparable) {
            return comparable;
        }
        return null;
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte;
    }
}
