package com.agilab.model_ingestion.filemap;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Recursive merge of nested option maps.
 *
 * <p>Nested maps merge key by key, any other value replaces the base value. A map carrying
 * {@code _replace: true} replaces the base value wholesale (the marker itself is dropped); at the top
 * level it replaces the whole base map.</p>
 */
public final class OptionsMerger {

    public static final String REPLACE_MARKER = "_replace";

    private OptionsMerger() {
    }

    public static Map<String, Object> override(Map<String, ?> base, Map<String, ?> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return copy(base);
        }
        if (isReplace(overrides)) {
            return withoutMarker(overrides);
        }
        var merged = copy(base);
        overrides.forEach((key, value) -> merged.put(key, mergeValue(merged.get(key), value)));
        return merged;
    }

    @SuppressWarnings("unchecked")
    private static Object mergeValue(Object baseValue, Object overrideValue) {
        if (!(overrideValue instanceof Map<?, ?> overrideMap)) {
            return overrideValue;
        }
        var overrides = (Map<String, ?>) overrideMap;
        if (isReplace(overrides) || !(baseValue instanceof Map<?, ?> baseMap)) {
            return withoutMarker(overrides);
        }
        return override((Map<String, ?>) baseMap, overrides);
    }

    private static boolean isReplace(Map<String, ?> map) {
        return map.containsKey(REPLACE_MARKER);
    }

    private static Map<String, Object> withoutMarker(Map<String, ?> map) {
        var result = copy(map);
        result.remove(REPLACE_MARKER);
        return result;
    }

    private static Map<String, Object> copy(Map<String, ?> map) {
        return map == null ? new LinkedHashMap<>() : new LinkedHashMap<>(map);
    }
}
