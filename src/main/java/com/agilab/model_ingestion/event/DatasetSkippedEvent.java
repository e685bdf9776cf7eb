package com.agilab.model_ingestion.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * An optional dataset had no file, so nothing was stored for it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public final class DatasetSkippedEvent implements IngestionEvent {
    private String datasetName;
    private String fileName;
    private String baseDirectory;
    private Instant timestamp;
    private String reason;
}
