package com.agilab.model_ingestion;

import com.agilab.model_ingestion.config.IngestionOptions;
import com.agilab.model_ingestion.config.IngestionProperties;
import com.agilab.model_ingestion.data.ParsedDataStore;
import com.agilab.model_ingestion.filemap.FileMap;
import com.agilab.model_ingestion.filemap.FileMapEntry;
import com.agilab.model_ingestion.filemap.ResolutionCache;
import com.agilab.model_ingestion.filter.FilterStep;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.Scope;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Ingests the entries of a file map into a {@link ParsedDataStore}.
 *
 * <p>A driver belongs to one translation run: its store accumulates across {@link #ingest} calls and a
 * dataset ingested again overwrites the earlier value. Entries are independent; with
 * {@code model-ingestion.parallelism} above 1 they are read on a worker pool.</p>
 */
@Slf4j
@Component
@Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
public class IngestionDriver {

    private final DatasetIngestor datasetIngestor;
    private final IngestionProperties properties;
    private final ParsedDataStore store = new ParsedDataStore();
    private final Map<String, Path> resolved = new ConcurrentHashMap<>();

    public IngestionDriver(DatasetIngestor datasetIngestor, IngestionProperties properties) {
        this.datasetIngestor = datasetIngestor;
        this.properties = properties;
    }

    /**
     * Resolves, decodes, filters and stores every active entry of the file map, in declared order.
     *
     * <p>The first failing entry aborts the call and its exception propagates; datasets stored before the
     * failure stay available through {@link #store()}.</p>
     *
     * @param baseDirectory run folder; when {@code null} nothing is ingested
     * @return this driver's store and the paths resolved by this call
     */
    public IngestionResult ingest(FileMap fileMap, Path baseDirectory, List<FilterStep> steps,
                                  IngestionOptions sharedOptions) {
        if (baseDirectory == null) {
            log.warn("Missing base folder, skipping {} file map entries", fileMap.size());
            return new IngestionResult(store, ResolutionCache.empty());
        }
        log.trace("Parsing {} file map entries from {}", fileMap.size(), baseDirectory);

        var active = fileMap.entries().stream()
                .filter(entry -> {
                    if (!entry.isActive()) {
                        log.debug("Skipping {}: no file name declared", entry.getName());
                    }
                    return entry.isActive();
                })
                .toList();

        var resolvedNow = new ConcurrentHashMap<String, Path>();
        if (properties.getParallelism() > 1 && active.size() > 1) {
            ingestConcurrently(active, baseDirectory, steps, sharedOptions, resolvedNow);
        } else {
            active.forEach(entry -> ingestEntry(entry, baseDirectory, steps, sharedOptions, resolvedNow));
        }
        return new IngestionResult(store, inFileMapOrder(fileMap, resolvedNow));
    }

    public ParsedDataStore store() {
        return store;
    }

    /**
     * Every path resolved by this driver so far, including calls that later failed.
     */
    public ResolutionCache resolutions() {
        return new ResolutionCache(resolved);
    }

    private void ingestEntry(FileMapEntry entry, Path baseDirectory, List<FilterStep> steps,
                             IngestionOptions sharedOptions, Map<String, Path> resolvedNow) {
        datasetIngestor.ingest(entry, baseDirectory, steps, sharedOptions).ifPresent(dataset -> {
            var previous = store.put(dataset.name(), dataset.data());
            if (previous.isPresent()) {
                log.debug("Replaced previously ingested data for {}", dataset.name());
            }
            resolvedNow.put(dataset.name(), dataset.path());
            resolved.put(dataset.name(), dataset.path());
        });
    }

    private void ingestConcurrently(List<FileMapEntry> entries, Path baseDirectory, List<FilterStep> steps,
                                    IngestionOptions sharedOptions, Map<String, Path> resolvedNow) {
        var executor = Executors.newFixedThreadPool(
                Math.min(properties.getParallelism(), entries.size()), new CustomizableThreadFactory("ingest-"));
        try {
            var futures = new LinkedHashMap<String, Future<?>>();
            entries.forEach(entry -> futures.put(entry.getName(), executor.submit(
                    () -> ingestEntry(entry, baseDirectory, steps, sharedOptions, resolvedNow))));

            // wait for every entry, then report the first failure in declared order
            RuntimeException firstFailure = null;
            for (var future : futures.entrySet()) {
                try {
                    future.getValue().get();
                } catch (ExecutionException e) {
                    if (firstFailure == null) {
                        firstFailure = asRuntimeException(future.getKey(), e.getCause());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while ingesting " + future.getKey(), e);
                }
            }
            if (firstFailure != null) {
                throw firstFailure;
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private static RuntimeException asRuntimeException(String name, Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IllegalStateException("Ingestion of " + name + " failed", cause);
    }

    private static ResolutionCache inFileMapOrder(FileMap fileMap, Map<String, Path> paths) {
        var ordered = new LinkedHashMap<String, Path>();
        fileMap.names().forEach(name -> {
            if (paths.containsKey(name)) {
                ordered.put(name, paths.get(name));
            }
        });
        return new ResolutionCache(ordered);
    }
}
