package com.agilab.model_ingestion.decode;

import com.agilab.model_ingestion.config.IngestionOptions;
import com.agilab.model_ingestion.data.EmptyDataset;
import com.agilab.model_ingestion.util.FileOperations;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Reads JSON records as plain maps, lists and scalars, without any normalization.
 */
@Component
@RequiredArgsConstructor
public class JsonDecoder implements DatasetDecoder {

    private final ObjectMapper objectMapper;
    private final FileOperations fileOperations;

    @Override
    public String formatTag() {
        return "json";
    }

    @Override
    public Object decode(Path path, IngestionOptions options) {
        var value = fileOperations.readWithRetry(path, file -> objectMapper.readValue(file.toFile(), Object.class));
        // a document holding only "null"
        return value == null ? EmptyDataset.INSTANCE : value;
    }
}
