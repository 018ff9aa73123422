package org.latticeville.runtime.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Order-preserving immutable copies of maps.
 * <p>
 * {@link Map#copyOf(Map)} does not keep iteration order stable between JVM runs, which
 * would make serialized payloads of two identical runs differ.
 */
public final class FrozenMaps {

    private FrozenMaps() {
    }

    /**
     * @param source The map to copy, may be {@code null}.
     * @return An unmodifiable copy in the source's iteration order.
     */
    public static <K, V> Map<K, V> copyOf(Map<K, V> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    /**
     * @param source A map of attribute maps, may be {@code null}.
     * @return An unmodifiable copy where every nested map is frozen as well.
     */
    public static Map<String, Map<String, String>> deepCopyOf(Map<String, ? extends Map<String, String>> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, copyOf(value)));
        return Collections.unmodifiableMap(copy);
    }
}
