package com.agilab.model_ingestion;

import com.agilab.model_ingestion.data.ParsedDataStore;
import com.agilab.model_ingestion.filemap.ResolutionCache;

/**
 * Outcome of {@link IngestionDriver#ingest}: the driver's store and the paths resolved by this call.
 */
public record IngestionResult(ParsedDataStore store, ResolutionCache resolutions) {
}
