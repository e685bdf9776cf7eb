package com.agilab.model_ingestion.util;

import com.agilab.model_ingestion.event.DatasetFailedEvent;
import com.agilab.model_ingestion.event.DatasetLoadedEvent;
import com.agilab.model_ingestion.event.DatasetSkippedEvent;
import com.agilab.model_ingestion.event.IngestionEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class IngestionEventHandlerTest {

    private final IngestionEventHandler eventHandler = new IngestionEventHandler();

    @Test
    void testLoadedEvent_Description() {
        var event = DatasetLoadedEvent.builder()
                .datasetName("capacity")
                .filePath("/runs/base/outputs/cap.csv")
                .baseDirectory("/runs/base")
                .timestamp(Instant.now())
                .dataType("Table")
                .build();

        assertInstanceOf(IngestionEvent.class, event);
        assertEquals("Loaded dataset 'capacity' from /runs/base/outputs/cap.csv as Table",
                eventHandler.getEventDescription(event));
    }

    @Test
    void testSkippedEvent_Description() {
        var event = DatasetSkippedEvent.builder()
                .datasetName("hierarchy")
                .fileName("hierarchy.csv")
                .baseDirectory("/runs/base")
                .timestamp(Instant.now())
                .reason("file not found")
                .build();

        assertEquals("Skipped dataset 'hierarchy' (hierarchy.csv): file not found",
                eventHandler.getEventDescription(event));
    }

    @Test
    void testFailedEvent_Description() {
        var event = DatasetFailedEvent.builder()
                .datasetName("load")
                .fileName("load.gdx")
                .baseDirectory("/runs/base")
                .timestamp(Instant.now())
                .errorMessage("File extension '.gdx' not yet supported")
                .errorType("UNSUPPORTED_FORMAT")
                .build();

        var description = eventHandler.getEventDescription(event);

        assertTrue(description.startsWith("Failed to ingest dataset 'load' (load.gdx)"));
        assertTrue(description.endsWith("(UNSUPPORTED_FORMAT)"));
        assertDoesNotThrow(() -> eventHandler.logEvent(event));
    }
}
