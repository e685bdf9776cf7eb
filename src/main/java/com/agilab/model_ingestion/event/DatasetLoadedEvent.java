package com.agilab.model_ingestion.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A dataset was decoded, filtered and stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public final class DatasetLoadedEvent implements IngestionEvent {
    private String datasetName;
    private String filePath;
    private String baseDirectory;
    private Instant timestamp;
    private String dataType;
}
