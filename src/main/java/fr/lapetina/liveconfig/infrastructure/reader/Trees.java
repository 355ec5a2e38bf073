package fr.lapetina.liveconfig.infrastructure.reader;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Helpers for configuration trees: nested {@code Map<String, Object>} with list and scalar leaves.
 *
 * A normalized tree only holds {@code String}, {@code Boolean}, {@code Long}, {@code Double},
 * {@code Map<String, Object>} and {@code List<Object>}, so that equal data always has equal types.
 */
public final class Trees {

    private Trees() {
        // Utility class
    }

    /**
     * Returns a mutable, normalized deep copy of {@code source}. Null entries are dropped.
     */
    public static Map<String, Object> normalize(Map<?, ?> source) {
        Map<String, Object> result = new LinkedHashMap<>();
        source.forEach((k, v) -> {
            Object normalized = normalizeValue(v);
            if (normalized != null) {
                result.put(String.valueOf(k), normalized);
            }
        });
        return result;
    }

    private static Object normalizeValue(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Map<?, ?> map) {
            return normalize(map);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> list = new ArrayList<>(collection.size());
            for (Object element : collection) {
                list.add(normalizeValue(element));
            }
            return list;
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof BigInteger big) {
            return big.bitLength() < Long.SIZE ? (Object) big.longValue() : (Object) big.doubleValue();
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof Date date) {
            return date.toInstant().toString();
        }
        return String.valueOf(value);
    }

    /**
     * Returns a mutable deep copy of a normalized tree.
     */
    public static Map<String, Object> deepCopy(Map<String, Object> tree) {
        Map<String, Object> result = new LinkedHashMap<>();
        tree.forEach((k, v) -> result.put(k, copyValue(v)));
        return result;
    }

    @SuppressWarnings("unchecked")
    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return deepCopy((Map<String, Object>) map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(copyValue(element));
            }
            return copy;
        }
        return value;
    }

    /**
     * Merges {@code source} into {@code target}. Mappings merge recursively; any other value,
     * lists included, replaces the target's.
     */
    @SuppressWarnings("unchecked")
    public static void deepMerge(Map<String, Object> target, Map<String, Object> source) {
        source.forEach((k, v) -> {
            Object existing = target.get(k);
            if (existing instanceof Map<?, ?> existingMap && v instanceof Map<?, ?> incoming) {
                deepMerge((Map<String, Object>) existingMap, (Map<String, Object>) incoming);
            } else {
                target.put(k, copyValue(v));
            }
        });
    }

    /**
     * Looks up a {@code .}-separated path.
     */
    public static Optional<Object> lookup(Map<String, Object> tree, String path) {
        if (path == null || path.isEmpty()) {
            return Optional.empty();
        }
        String[] segments = path.split("\\.", -1);
        Object current = tree;
        for (String segment : segments) {
            if (!(current instanceof Map<?, ?> map)) {
                return Optional.empty();
            }
            current = map.get(segment);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    /**
     * Places {@code value} at a {@code .}-separated path, creating or replacing intermediate mappings.
     */
    @SuppressWarnings("unchecked")
    public static void putPath(Map<String, Object> target, String path, Object value) {
        String[] segments = path.split("\\.", -1);
        Map<String, Object> current = target;
        for (int i = 0; i < segments.length - 1; i++) {
            Object next = current.get(segments[i]);
            if (!(next instanceof Map<?, ?>)) {
                next = new LinkedHashMap<String, Object>();
                current.put(segments[i], next);
            }
            current = (Map<String, Object>) next;
        }
        current.put(segments[segments.length - 1], value);
    }

    /**
     * Returns an unmodifiable deep copy, safe to hand out to readers.
     */
    @SuppressWarnings("unchecked")
    public static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            ((Map<String, Object>) map).forEach((k, v) -> copy.put(k, freeze(v)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(freeze(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
