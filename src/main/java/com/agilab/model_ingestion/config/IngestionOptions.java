package com.agilab.model_ingestion.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, layered option set passed to decoders and filter steps.
 *
 * <p>Layers are applied lowest first: configured defaults, then options shared by the whole run,
 * then the options declared on a single file map entry. A higher layer wins on key collision.
 * Null values are ignored, so they never hide a lower layer.</p>
 */
public final class IngestionOptions {

    public static final String OPTIONAL = "optional";
    public static final String KEEP_CASE = "keep_case";
    public static final String CSV_FILE_ENCODING = "csv_file_encoding";
    public static final String DELIMITER = "delimiter";
    public static final String PRODUCER_PROFILE = "producer_profile";
    public static final String COLUMN_MAPPING = "column_mapping";
    public static final String SOLVE_YEAR = "solve_year";
    public static final String YEAR = "year";
    public static final String YEAR_COLUMN = "year_column";
    public static final String MODEL = "model";
    public static final String NAMESPACE = "namespace";
    public static final String IGNORE_COMMENTS = "ignore_comments";

    private static final IngestionOptions EMPTY = new IngestionOptions(Map.of());

    private final Map<String, Object> values;

    private IngestionOptions(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static IngestionOptions empty() {
        return EMPTY;
    }

    public static IngestionOptions of(Map<String, ?> values) {
        return EMPTY.overriddenBy(values);
    }

    /**
     * Merges the three layers; {@code entry} overrides {@code shared}, which overrides {@code defaults}.
     */
    public static IngestionOptions layered(Map<String, ?> defaults, Map<String, ?> shared, Map<String, ?> entry) {
        return of(defaults).overriddenBy(shared).overriddenBy(entry);
    }

    public IngestionOptions overriddenBy(Map<String, ?> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        var merged = new LinkedHashMap<>(values);
        overrides.forEach((key, value) -> {
            if (key != null && value != null) {
                merged.put(key, value);
            }
        });
        return new IngestionOptions(merged);
    }

    public IngestionOptions overriddenBy(IngestionOptions overrides) {
        return overriddenBy(overrides.values);
    }

    public IngestionOptions with(String key, Object value) {
        return overriddenBy(Collections.singletonMap(key, value));
    }

    /**
     * Keeps only the given keys, dropping everything else silently.
     */
    public IngestionOptions only(Set<String> keys) {
        var kept = new LinkedHashMap<String, Object>();
        values.forEach((key, value) -> {
            if (keys.contains(key)) {
                kept.put(key, value);
            }
        });
        return new IngestionOptions(kept);
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public Optional<String> getString(String key) {
        return get(key).map(Object::toString);
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        var value = values.get(key);
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String text) {
            return Boolean.parseBoolean(text.trim());
        }
        return defaultValue;
    }

    /**
     * @throws IllegalArgumentException when the value is neither a number nor a numeric string
     */
    public Optional<Integer> getInteger(String key) {
        return get(key).map(value -> {
            if (value instanceof Number number) {
                return number.intValue();
            }
            try {
                return Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(String.format("Option %s is not an integer: %s", key, value), e);
            }
        });
    }

    /**
     * Reads a nested map option, converting keys and values to strings. Missing or non-map values yield an empty map.
     */
    public Map<String, String> getStringMap(String key) {
        var value = values.get(key);
        if (!(value instanceof Map<?, ?> map)) {
            return Map.of();
        }
        var result = new LinkedHashMap<String, String>();
        map.forEach((k, v) -> {
            if (k != null && v != null) {
                result.put(k.toString(), v.toString());
            }
        });
        return Collections.unmodifiableMap(result);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof IngestionOptions other && values.equals(other.values));
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "IngestionOptions" + values;
    }
}
