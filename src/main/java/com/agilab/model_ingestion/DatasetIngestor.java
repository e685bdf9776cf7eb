package com.agilab.model_ingestion;

import com.agilab.model_ingestion.config.IngestionOptions;
import com.agilab.model_ingestion.config.IngestionProperties;
import com.agilab.model_ingestion.decode.DecoderRegistry;
import com.agilab.model_ingestion.event.DatasetFailedEvent;
import com.agilab.model_ingestion.event.DatasetLoadedEvent;
import com.agilab.model_ingestion.event.DatasetSkippedEvent;
import com.agilab.model_ingestion.event.IngestionEventPublisher;
import com.agilab.model_ingestion.exception.IngestionExceptionHandler;
import com.agilab.model_ingestion.exception.MissingMandatoryFileException;
import com.agilab.model_ingestion.filemap.FileMapEntry;
import com.agilab.model_ingestion.filter.FilterContext;
import com.agilab.model_ingestion.filter.FilterPipeline;
import com.agilab.model_ingestion.filter.FilterStep;
import com.agilab.model_ingestion.resolve.FileResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Runs one file map entry through resolution, decoding and filtering.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatasetIngestor {

    private final FileResolver fileResolver;
    private final DecoderRegistry decoderRegistry;
    private final FilterPipeline filterPipeline;
    private final IngestionEventPublisher eventPublisher;
    private final IngestionExceptionHandler exceptionHandler;
    private final IngestionProperties properties;

    public record IngestedDataset(String name, Path path, Object data) {
    }

    /**
     * @return the filtered data and the path it was read from, or empty when an optional file is absent
     */
    Optional<IngestedDataset> ingest(FileMapEntry entry, Path baseDirectory, List<FilterStep> steps,
                                     IngestionOptions sharedOptions) {
        var name = entry.getName();
        try {
            var path = locate(entry, baseDirectory);
            if (path.isEmpty()) {
                publishSkipped(entry, baseDirectory, "file not found");
                return Optional.empty();
            }

            var options = optionsFor(entry, sharedOptions);
            var decoded = decoderRegistry.decode(path.get(), options);
            if (decoded.isEmpty()) {
                publishSkipped(entry, baseDirectory, "pinned file " + path.get() + " does not exist");
                return Optional.empty();
            }

            var data = filterPipeline.apply(decoded.get(), steps, FilterContext.of(name, options));
            log.debug("Loaded file for {} from {}", name, path.get());
            eventPublisher.publish(DatasetLoadedEvent.builder()
                    .datasetName(name)
                    .filePath(path.get().toString())
                    .baseDirectory(baseDirectory.toString())
                    .timestamp(Instant.now())
                    .dataType(data.getClass().getSimpleName())
                    .build());
            return Optional.of(new IngestedDataset(name, path.get(), data));
        } catch (RuntimeException e) {
            exceptionHandler.logException(name, e);
            eventPublisher.publish(DatasetFailedEvent.builder()
                    .datasetName(name)
                    .fileName(entry.getFname())
                    .baseDirectory(baseDirectory.toString())
                    .timestamp(Instant.now())
                    .errorMessage(e.getMessage())
                    .errorType(exceptionHandler.classify(e))
                    .build());
            throw e;
        }
    }

    // A pinned path always wins over searching; relative pins are taken from the run folder
    private Optional<Path> locate(FileMapEntry entry, Path baseDirectory) {
        var pinned = entry.getPinnedPath().map(baseDirectory::resolve);
        if (pinned.isEmpty()) {
            return fileResolver.resolve(entry.getFname(), baseDirectory, entry.isOptional());
        }
        log.trace("Using pinned path {} for {}", pinned.get(), entry.getName());
        if (!entry.isOptional() && !Files.exists(pinned.get())) {
            throw new MissingMandatoryFileException(pinned.get().toString(), baseDirectory);
        }
        return pinned;
    }

    IngestionOptions optionsFor(FileMapEntry entry, IngestionOptions sharedOptions) {
        return IngestionOptions.of(properties.getDefaultOptions())
                .overriddenBy(sharedOptions)
                .overriddenBy(entry.getOptions())
                .with(IngestionOptions.OPTIONAL, entry.isOptional());
    }

    private void publishSkipped(FileMapEntry entry, Path baseDirectory, String reason) {
        eventPublisher.publish(DatasetSkippedEvent.builder()
                .datasetName(entry.getName())
                .fileName(entry.getFname())
                .baseDirectory(baseDirectory.toString())
                .timestamp(Instant.now())
                .reason(reason)
                .build());
    }
}
