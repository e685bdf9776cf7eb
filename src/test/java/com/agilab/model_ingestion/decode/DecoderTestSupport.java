package com.agilab.model_ingestion.decode;

import com.agilab.model_ingestion.config.IngestionProperties;
import com.agilab.model_ingestion.util.FileOperations;
import org.springframework.retry.support.RetryTemplate;

import java.io.IOException;

final class DecoderTestSupport {

    private DecoderTestSupport() {
    }

    static FileOperations fileOperations() {
        var retryTemplate = RetryTemplate.builder()
                .maxAttempts(2)
                .fixedBackoff(10)
                .retryOn(IOException.class)
                .build();
        return new FileOperations(retryTemplate, new IngestionProperties());
    }
}
