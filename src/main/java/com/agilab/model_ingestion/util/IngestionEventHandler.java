package com.agilab.model_ingestion.util;

import com.agilab.model_ingestion.event.DatasetFailedEvent;
import com.agilab.model_ingestion.event.DatasetLoadedEvent;
import com.agilab.model_ingestion.event.DatasetSkippedEvent;
import com.agilab.model_ingestion.event.IngestionEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Describes ingestion events and logs them as they are published.
 */
@Slf4j
@Component
public class IngestionEventHandler {

    public String getEventDescription(IngestionEvent event) {
        if (event instanceof DatasetLoadedEvent loaded) {
            return String.format("Loaded dataset '%s' from %s as %s",
                    loaded.getDatasetName(), loaded.getFilePath(), loaded.getDataType());
        } else if (event instanceof DatasetSkippedEvent skipped) {
            return String.format("Skipped dataset '%s' (%s): %s",
                    skipped.getDatasetName(), skipped.getFileName(), skipped.getReason());
        }
        var failed = (DatasetFailedEvent) event;
        return String.format("Failed to ingest dataset '%s' (%s): %s (%s)",
                failed.getDatasetName(), failed.getFileName(), failed.getErrorMessage(), failed.getErrorType());
    }

    @EventListener
    public void logEvent(IngestionEvent event) {
        if (event instanceof DatasetFailedEvent) {
            log.error("Error: {}", getEventDescription(event));
        } else if (event instanceof DatasetSkippedEvent) {
            log.info("Skipped: {}", getEventDescription(event));
        } else {
            log.debug("Loaded: {}", getEventDescription(event));
        }
    }
}
