package com.agilab.model_ingestion.filter;

import com.agilab.model_ingestion.config.IngestionOptions;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Read-only context handed to every step of a pipeline run.
 */
@Value
@Builder
public class FilterContext {

    String datasetName;

    @NonNull
    @Builder.Default
    IngestionOptions options = IngestionOptions.empty();

    public static FilterContext of(String datasetName, IngestionOptions options) {
        return FilterContext.builder().datasetName(datasetName).options(options).build();
    }
}
