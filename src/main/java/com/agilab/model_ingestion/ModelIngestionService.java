package com.agilab.model_ingestion;

import com.agilab.model_ingestion.config.IngestionOptions;
import com.agilab.model_ingestion.filter.DefaultFilterPolicy;
import com.agilab.model_ingestion.filter.FilterStep;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class ModelIngestionService {

    private final DefaultFilterPolicy filterPolicy;
    private final ObjectProvider<IngestionDriver> drivers;

    public ModelIngestionService(DefaultFilterPolicy filterPolicy, ObjectProvider<IngestionDriver> drivers) {
        this.filterPolicy = filterPolicy;
        this.drivers = drivers;
    }

    public <S> ParsedModel<S> parse(ModelScenario scenario, Ingestable<S> ingestable) {
        return parse(scenario, ingestable, null, Map.of());
    }

    /**
     * Ingests every file of the scenario's file map from its run folder.
     *
     * @param explicitSteps filter steps to apply instead of the model family defaults, or {@code null}
     * @param options options shared by every entry, taking precedence over the scenario's input config
     */
    public <S> ParsedModel<S> parse(ModelScenario scenario, Ingestable<S> ingestable,
                                    List<FilterStep> explicitSteps, Map<String, Object> options) {
        var steps = filterPolicy.stepsFor(scenario.getInputModel(), explicitSteps);
        var shared = sharedOptions(scenario, ingestable, options);
        log.info("Parsing {} files for scenario {} from {}", scenario.getFileMap().size(), scenario.getName(),
                scenario.getRunFolder());

        var driver = drivers.getObject();
        var result = driver.ingest(scenario.getFileMap(), scenario.getRunFolder(), steps, shared);
        log.info("Parsed {} datasets for scenario {}", result.store().size(), scenario.getName());
        return new ParsedModel<>(scenario, ingestable, result);
    }

    IngestionOptions sharedOptions(ModelScenario scenario, Ingestable<?> ingestable, Map<String, Object> options) {
        var shared = IngestionOptions.of(scenario.getInputConfig()).overriddenBy(options);
        if (scenario.getModel() != null && !shared.contains(IngestionOptions.MODEL)) {
            shared = shared.with(IngestionOptions.MODEL, scenario.getModel());
        }
        if (!shared.contains(IngestionOptions.PRODUCER_PROFILE)) {
            var profile = ingestable.producerProfile();
            if (profile.isPresent()) {
                shared = shared.with(IngestionOptions.PRODUCER_PROFILE, profile.get());
            }
        }
        return shared;
    }
}
