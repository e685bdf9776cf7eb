package com.agilab.model_ingestion.data;

import com.agilab.model_ingestion.exception.UnknownDatasetException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;


/**
 * Decoded datasets keyed by logical dataset name, in the order they were stored.
 *
 * <p>Writes overwrite the previous value for the same name. Safe for concurrent writers as long as
 * each name has a single writer.</p>
 */
public final class ParsedDataStore {

    private final Map<String, Object> data = Collections.synchronizedMap(new LinkedHashMap<>());

    /**
     * @return the value previously stored under the name, if any
     */
    public Optional<Object> put(String name, Object value) {
        return Optional.ofNullable(data.put(name, value));
    }

    /**
     * @throws UnknownDatasetException when nothing was stored under the name
     */
    public Object get(String name) {
        var value = data.get(name);
        if (value == null) {
            throw new UnknownDatasetException(name);
        }
        return value;
    }

    public <T> T get(String name, Class<T> type) {
        var value = get(name);
        if (!type.isInstance(value)) {
            throw new ClassCastException(String.format(
                    "Dataset `%s` is a %s, not a %s", name, value.getClass().getSimpleName(), type.getSimpleName()));
        }
        return type.cast(value);
    }

    public Optional<Object> find(String name) {
        return Optional.ofNullable(data.get(name));
    }

    public boolean contains(String name) {
        return data.containsKey(name);
    }

    public List<String> names() {
        synchronized (data) {
            return List.copyOf(data.keySet());
        }
    }

    public int size() {
        return data.size();
    }

    public boolean isEmpty() {
        return data.isEmpty();
    }

    public Map<String, Object> snapshot() {
        synchronized (data) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(data));
        }
    }

    @Override
    public String toString() {
        return "ParsedDataStore(Files parsed: " + size() + ")";
    }
}
