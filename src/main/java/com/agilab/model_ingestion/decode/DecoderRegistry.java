package com.agilab.model_ingestion.decode;

import com.agilab.model_ingestion.config.IngestionOptions;
import com.agilab.model_ingestion.exception.UnsupportedFormatException;
import com.agilab.model_ingestion.util.FileOperations;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Dispatch table from file extension to {@link DatasetDecoder}. Unregistered extensions fail closed.
 */
@Slf4j
@Component
public class DecoderRegistry {

    private final Map<String, DatasetDecoder> decoders;

    public DecoderRegistry(List<DatasetDecoder> decoders) {
        var table = new TreeMap<String, DatasetDecoder>();
        for (var decoder : decoders) {
            var tag = decoder.formatTag().toLowerCase(Locale.ROOT);
            var previous = table.putIfAbsent(tag, decoder);
            if (previous != null) {
                throw new IllegalStateException(String.format("Decoders %s and %s both claim format '%s'",
                        previous.getClass().getSimpleName(), decoder.getClass().getSimpleName(), tag));
            }
        }
        this.decoders = Collections.unmodifiableMap(table);
        log.debug("Registered decoders for formats {}", this.decoders.keySet());
    }

    public Map<String, DatasetDecoder> getDecoders() {
        return decoders;
    }

    public boolean supports(Path path) {
        return decoders.containsKey(FileOperations.getFileExtension(path));
    }

    /**
     * Decodes the file with the decoder registered for its extension.
     *
     * @return empty when the options mark the file optional and it does not exist
     * @throws UnsupportedFormatException when no decoder handles the extension
     */
    public Optional<Object> decode(Path path, IngestionOptions options) {
        log.trace("Attempting to read: {}", path);
        if (options.getBoolean(IngestionOptions.OPTIONAL, false) && !Files.exists(path)) {
            log.debug("Could not find optional file {}", path);
            return Optional.empty();
        }

        var extension = FileOperations.getFileExtension(path);
        var decoder = decoders.get(extension);
        if (decoder == null) {
            throw new UnsupportedFormatException(path.toString(), extension,
                    String.format("File extension '.%s' of %s not yet supported. Supported: %s",
                            extension.toLowerCase(Locale.ROOT), path, decoders.keySet()));
        }
        log.trace("Reading {} with {}", path, decoder.getClass().getSimpleName());
        return Optional.of(decoder.decode(path, options));
    }
}
