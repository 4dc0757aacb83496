package com.trustbridge.secrets;

import lombok.experimental.UtilityClass;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Dot-path access into nested configuration trees, e.g. {@code infrastructure.redis.url}.
 */
@UtilityClass
public class KeyPaths {

    /**
     * A key present verbatim at the top level wins over path traversal.
     */
    public static Optional<Object> get(Map<String, Object> tree, String path) {
        if (tree == null || path == null) {
            return Optional.empty();
        }
        if (tree.containsKey(path)) {
            return Optional.ofNullable(tree.get(path));
        }
        Object current = tree;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map) || !map.containsKey(segment)) {
                return Optional.empty();
            }
            current = map.get(segment);
        }
        return Optional.ofNullable(current);
    }

    /**
     * Sets a value, creating intermediate maps. A non-map value in the way is replaced by a map. Intermediate maps
     * along the path are replaced by string-keyed copies.
     */
    public static void set(Map<String, Object> tree, String path, Object value) {
        String[] segments = path.split("\\.");
        Map<String, Object> current = tree;
        for (int i = 0; i < segments.length - 1; i++) {
            Map<String, Object> next = new LinkedHashMap<>();
            if (current.get(segments[i]) instanceof Map<?, ?> existing) {
                existing.forEach((key, nested) -> next.put(String.valueOf(key), nested));
            }
            current.put(segments[i], next);
            current = next;
        }
        current.put(segments[segments.length - 1], value);
    }

    /**
     * @return every leaf of the tree keyed by its dot path
     */
    public static Map<String, Object> flatten(Map<String, Object> tree) {
        Map<String, Object> flat = new LinkedHashMap<>();
        flatten("", tree, flat);
        return flat;
    }

    private static void flatten(String prefix, Map<?, ?> tree, Map<String, Object> flat) {
        tree.forEach((key, value) -> {
            String path = prefix.isEmpty() ? String.valueOf(key) : prefix + "." + key;
            if (value instanceof Map<?, ?> nested && !SecretMarker.isMarker(nested)) {
                flatten(path, nested, flat);
            } else {
                flat.put(path, value);
            }
        });
    }
}
