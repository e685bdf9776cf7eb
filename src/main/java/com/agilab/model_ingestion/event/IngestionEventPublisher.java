package com.agilab.model_ingestion.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Publishes ingestion outcomes to Spring listeners. A failing listener never fails the ingestion.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IngestionEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;

    public boolean publish(IngestionEvent event) {
        try {
            applicationEventPublisher.publishEvent(event);
            return true;
        } catch (RuntimeException e) {
            log.error("Error publishing {} for dataset {}", event.getClass().getSimpleName(), event.getDatasetName(), e);
            return false;
        }
    }
}
