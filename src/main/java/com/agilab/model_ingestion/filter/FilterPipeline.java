package com.agilab.model_ingestion.filter;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Applies filter steps left to right, each step receiving the previous step's output.
 */
@Slf4j
@Component
public class FilterPipeline {

    public Object apply(Object data, List<FilterStep> steps, FilterContext context) {
        var current = data;
        for (var step : steps) {
            log.trace("Applying {} to {}", step.name(), context.getDatasetName());
            current = step.apply(current, context);
        }
        return current;
    }
}
