package com.agilab.model_ingestion.filemap;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Paths resolved during an ingestion, keyed by logical dataset name.
 * Merge it into the file map with {@link FileMap#withResolvedPaths(ResolutionCache)} to skip the search next time.
 */
public final class ResolutionCache {

    private static final ResolutionCache EMPTY = new ResolutionCache(Map.of());

    private final Map<String, Path> paths;

    public ResolutionCache(Map<String, Path> paths) {
        this.paths = Collections.unmodifiableMap(new LinkedHashMap<>(paths));
    }

    public static ResolutionCache empty() {
        return EMPTY;
    }

    public Optional<Path> get(String name) {
        return Optional.ofNullable(paths.get(name));
    }

    public Map<String, Path> asMap() {
        return paths;
    }

    public int size() {
        return paths.size();
    }

    public boolean isEmpty() {
        return paths.isEmpty();
    }

    /**
     * @return a cache holding both sets of paths, {@code other} winning for names present in both
     */
    public ResolutionCache merge(ResolutionCache other) {
        var merged = new LinkedHashMap<>(paths);
        merged.putAll(other.paths);
        return new ResolutionCache(merged);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ResolutionCache other && paths.equals(other.paths));
    }

    @Override
    public int hashCode() {
        return paths.hashCode();
    }

    @Override
    public String toString() {
        return "ResolutionCache" + paths;
    }
}
