package com.agilab.model_ingestion.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "model-ingestion")
@Data
@Component
public class IngestionProperties {
    // Consulted in order, relative to the run folder. "." is the run folder itself.
    private List<String> searchFolders = new ArrayList<>(List.of(
            "outputs",
            "inputs_case",
            "outputs_perturb",
            "inputs_case/supplycurve_metadata",
            "."));
    private int parallelism = 1;
    private int retryAttempts = 3;
    private Duration retryDelay = Duration.ofMillis(200);
    private Map<String, Object> defaultOptions = new HashMap<>();
    private Map<String, List<String>> defaultFilters = new LinkedHashMap<>(Map.of(
            "reeds-US", List.of("rename", "filter_year")));
}
