package com.agilab.model_ingestion;

import com.agilab.model_ingestion.data.ParsedDataStore;
import com.agilab.model_ingestion.filemap.FileMap;

/**
 * Datasets ingested for a scenario, ready to be translated by the source system that asked for them.
 */
public record ParsedModel<S>(ModelScenario scenario, Ingestable<S> ingestable, IngestionResult result) {

    public S buildSystem() {
        return ingestable.buildSystem(result.store());
    }

    public Object getData(String key) {
        return result.store().get(key);
    }

    public ParsedDataStore store() {
        return result.store();
    }

    /**
     * The scenario's file map with every path found during this run pinned, so a second run skips the search.
     */
    public FileMap fileMapWithResolvedPaths() {
        return scenario.getFileMap().withResolvedPaths(result.resolutions());
    }
}
