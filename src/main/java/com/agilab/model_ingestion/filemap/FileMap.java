package com.agilab.model_ingestion.filemap;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered, immutable set of file map entries keyed by logical dataset name.
 */
public final class FileMap {

    private final Map<String, FileMapEntry> entries;

    private FileMap(Map<String, FileMapEntry> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static FileMap of(Collection<FileMapEntry> entries) {
        var byName = new LinkedHashMap<String, FileMapEntry>();
        entries.forEach(entry -> byName.put(entry.getName(), entry));
        return new FileMap(byName);
    }

    public static FileMap of(FileMapEntry... entries) {
        return of(List.of(entries));
    }

    /**
     * @param descriptors logical name to descriptor map, every descriptor itself a map
     * @throws IllegalArgumentException when a descriptor is not a map
     */
    public static FileMap fromDescriptors(Map<String, ?> descriptors) {
        var byName = new LinkedHashMap<String, FileMapEntry>();
        descriptors.forEach((name, descriptor) -> {
            if (!(descriptor instanceof Map<?, ?> map)) {
                throw new IllegalArgumentException(String.format("Descriptor of %s must be a map: %s", name, descriptor));
            }
            var fields = new LinkedHashMap<String, Object>();
            map.forEach((key, value) -> fields.put(String.valueOf(key), value));
            byName.put(name, FileMapEntry.fromDescriptor(name, fields));
        });
        return new FileMap(byName);
    }

    public List<FileMapEntry> entries() {
        return List.copyOf(entries.values());
    }

    public Optional<FileMapEntry> get(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    public List<String> names() {
        return List.copyOf(entries.keySet());
    }

    public int size() {
        return entries.size();
    }

    /**
     * @return a copy of this map with the cached paths pinned on the matching entries
     */
    public FileMap withResolvedPaths(ResolutionCache cache) {
        var pinned = new LinkedHashMap<String, FileMapEntry>();
        entries.forEach((name, entry) -> pinned.put(name,
                cache.get(name).map(entry::withResolvedPath).orElse(entry)));
        return new FileMap(pinned);
    }

    /**
     * Applies user overrides to the descriptors, following {@link OptionsMerger#override} rules.
     */
    public FileMap withOverrides(Map<String, ?> overrides) {
        return fromDescriptors(OptionsMerger.override(toDescriptors(), overrides));
    }

    public Map<String, Object> toDescriptors() {
        var descriptors = new LinkedHashMap<String, Object>();
        entries.forEach((name, entry) -> descriptors.put(name, entry.toDescriptor()));
        return descriptors;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof FileMap other && entries.equals(other.entries));
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "FileMap" + entries.keySet();
    }
}
