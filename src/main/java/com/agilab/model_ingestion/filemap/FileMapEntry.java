package com.agilab.model_ingestion.filemap;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Source descriptor of one logical dataset.
 *
 * <p>{@code fname} activates the entry; {@code optional} tolerates its absence; {@code fpath} pins the
 * file and skips the search. Every other key of the descriptor is kept in {@code options} and handed to
 * the decoder and the filter steps.</p>
 */
@Value
@Builder(toBuilder = true)
public class FileMapEntry {

    public static final String FNAME = "fname";
    public static final String OPTIONAL = "optional";
    public static final String FPATH = "fpath";

    @NonNull
    String name;
    String fname;
    boolean optional;
    Path fpath;
    @Singular
    Map<String, Object> options;

    public boolean isActive() {
        return StringUtils.isNotBlank(fname);
    }

    public Optional<Path> getPinnedPath() {
        return Optional.ofNullable(fpath);
    }

    public FileMapEntry withResolvedPath(Path path) {
        return toBuilder().fpath(path).build();
    }

    /**
     * Builds an entry from a raw descriptor such as one read from a file map document.
     */
    public static FileMapEntry fromDescriptor(String name, Map<String, ?> descriptor) {
        var builder = FileMapEntry.builder().name(name);
        descriptor.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            switch (key) {
                case FNAME -> builder.fname(value.toString());
                case OPTIONAL -> builder.optional(value instanceof Boolean b ? b : Boolean.parseBoolean(value.toString()));
                case FPATH -> builder.fpath(Path.of(value.toString()));
                default -> builder.option(key, value);
            }
        });
        return builder.build();
    }

    public Map<String, Object> toDescriptor() {
        var descriptor = new LinkedHashMap<String, Object>();
        if (fname != null) {
            descriptor.put(FNAME, fname);
        }
        descriptor.put(OPTIONAL, optional);
        if (fpath != null) {
            descriptor.put(FPATH, fpath.toString());
        }
        descriptor.putAll(options);
        return descriptor;
    }
}
