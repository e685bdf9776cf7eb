package com.agilab.model_ingestion;

import com.agilab.model_ingestion.filemap.FileMap;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.Map;

/**
 * One translation run: which model family is read, from which run folder, with which files and options.
 */
@Value
@Builder(toBuilder = true)
public class ModelScenario {
    @NonNull
    String name;
    // Selects the default filter steps, for example "reeds-US"
    String inputModel;
    Path runFolder;
    @NonNull
    FileMap fileMap;
    @Singular("inputOption")
    Map<String, Object> inputConfig;
    String model;
}
