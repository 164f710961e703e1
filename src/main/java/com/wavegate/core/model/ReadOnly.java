package com.wavegate.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deep, unmodifiable copies of the JSON-shaped values that task executors exchange.
 * <p>
 * Nested maps and collections are copied and wrapped at every level; scalars are shared.
 * Null values are kept and key order is preserved, which {@code Map.copyOf} would not do.
 */
public final class ReadOnly {

    private ReadOnly() {
    }

    public static <V> Map<String, V> map(Map<String, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        var copy = new LinkedHashMap<String, V>(source.size() * 2);
        source.forEach((key, value) -> copy.put(key, freeze(value)));
        return Collections.unmodifiableMap(copy);
    }

    @SuppressWarnings("unchecked")
    static <V> V freeze(V value) {
        if (value instanceof Map<?, ?> nested) {
            var copy = new LinkedHashMap<Object, Object>(nested.size() * 2);
            nested.forEach((key, inner) -> copy.put(key, freeze(inner)));
            return (V) Collections.unmodifiableMap(copy);
        }
        if (value instanceof Collection<?> items) {
            List<Object> copy = new ArrayList<>(items.size());
            for (Object item : items) {
                copy.add(freeze(item));
            }
            return (V) Collections.unmodifiableList(copy);
        }
        return value;
    }
}
