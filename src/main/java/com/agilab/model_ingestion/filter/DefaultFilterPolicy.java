package com.agilab.model_ingestion.filter;

import com.agilab.model_ingestion.config.IngestionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Chooses the filter steps of a run. Explicit steps always win; otherwise the steps configured for the
 * input-model family under {@code model-ingestion.default-filters} are used.
 */
@Slf4j
@Component
public class DefaultFilterPolicy {

    private final Map<String, FilterStep> stepsByName;
    private final IngestionProperties properties;

    public DefaultFilterPolicy(List<FilterStep> steps, IngestionProperties properties) {
        var byName = new TreeMap<String, FilterStep>();
        steps.forEach(step -> byName.put(step.name(), step));
        this.stepsByName = Collections.unmodifiableMap(byName);
        this.properties = properties;
    }

    public List<FilterStep> stepsFor(String inputModel, List<FilterStep> explicitSteps) {
        if (explicitSteps != null) {
            return List.copyOf(explicitSteps);
        }
        var names = defaultStepNames(inputModel);
        if (!names.isEmpty()) {
            log.trace("Using default filter functions {} for {}", names, inputModel);
        }
        var steps = new ArrayList<FilterStep>(names.size());
        for (var name : names) {
            var step = stepsByName.get(name);
            if (step == null) {
                throw new IllegalStateException(String.format(
                        "Unknown filter step '%s' configured for %s. Known steps: %s", name, inputModel, stepsByName.keySet()));
            }
            steps.add(step);
        }
        return List.copyOf(steps);
    }

    public FilterStep step(String name) {
        var step = stepsByName.get(name);
        if (step == null) {
            throw new IllegalArgumentException("Unknown filter step: " + name);
        }
        return step;
    }

    // Spring may lower-case map keys on binding, so families match ignoring case
    private List<String> defaultStepNames(String inputModel) {
        if (inputModel == null) {
            return List.of();
        }
        return properties.getDefaultFilters().entrySet().stream()
                .filter(entry -> entry.getKey().equalsIgnoreCase(inputModel))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(List.of());
    }
}
