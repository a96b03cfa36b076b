package io.github.jbellis.mdident.node;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Deep copies of node metadata. Nested maps and collections are copied into unmodifiable
 * containers so that a node never shares mutable state with its caller or with another node.
 * Null values are kept; JSON documents may carry them.
 */
public final class Metadata {
    private Metadata() {
    }

    public static Map<String, Object> copyOf(Map<String, ?> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        var copy = new LinkedHashMap<String, Object>();
        source.forEach((key, value) -> copy.put(Objects.requireNonNull(key, "metadata key"), copyValue(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            var nested = new LinkedHashMap<String, Object>();
            map.forEach((k, v) -> nested.put(String.valueOf(k), copyValue(v)));
            return Collections.unmodifiableMap(nested);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> nested = new ArrayList<>(collection.size());
            for (Object element : collection) {
                nested.add(copyValue(element));
            }
            return Collections.unmodifiableList(nested);
        }
        return value;
    }
}
