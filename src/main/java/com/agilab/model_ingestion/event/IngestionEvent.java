package com.agilab.model_ingestion.event;

import java.time.Instant;

/**
 * Sealed interface for per-dataset outcomes of an ingestion run.
 */
public sealed interface IngestionEvent permits DatasetLoadedEvent, DatasetSkippedEvent, DatasetFailedEvent {
    String getDatasetName();
    Instant getTimestamp();
    String getBaseDirectory();
}
