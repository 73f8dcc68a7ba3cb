package com.routedoc.service.support;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive merging of JSON-like trees made of maps, lists and scalar values.
 */
public final class JsonMerge {

    private JsonMerge() {
    }

    /**
     * Merges {@code overlay} into {@code base} and returns {@code base}.
     * <p>
     * For a key present in both, two maps are merged recursively and anything else is replaced
     * by the overlay value. Keys only present in the overlay are added, keys only present in the
     * base are kept. For example merging {@code {"c": {"b": 2}}} into {@code {"c": {"a": 1}}}
     * gives {@code {"c": {"a": 1, "b": 2}}}. The overlay is not modified.
     *
     * @param base    The tree to merge into; must be mutable at every level that is merged.
     * @param overlay The overriding values.
     * @return {@code base}
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> merge(Map<String, Object> base, Map<String, ?> overlay) {
        if (overlay == null) {
            return base;
        }
        overlay.forEach((key, value) -> {
            Object current = base.get(key);
            if (current instanceof Map && value instanceof Map) {
                Map<String, Object> target = (Map<String, Object>) current;
                base.put(key, merge(mutable(target), (Map<String, ?>) value));
            } else {
                base.put(key, deepCopyValue(value));
            }
        });
        return base;
    }

    /**
     * @return A copy of the tree in which every map and list is a fresh mutable instance.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> deepCopy(Map<String, ?> tree) {
        if (tree == null) {
            return null;
        }
        return (Map<String, Object>) deepCopyValue(tree);
    }

    private static Object deepCopyValue(Object value) {
        if (value instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> copy.put(String.valueOf(k), deepCopyValue(v)));
            return copy;
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            ((List<?>) value).forEach(v -> copy.add(deepCopyValue(v)));
            return copy;
        }
        return value;
    }

    // Immutable nodes (Map.of) cannot be merged into in place.
    private static Map<String, Object> mutable(Map<String, Object> map) {
        if (map instanceof LinkedHashMap) {
            return map;
        }
        return deepCopy(map);
    }
}
