package com.agilab.model_ingestion.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public final class DatasetFailedEvent implements IngestionEvent {
    private String datasetName;
    private String fileName;
    private String baseDirectory;
    private Instant timestamp;
    private String errorMessage;
    private String errorType;
}
