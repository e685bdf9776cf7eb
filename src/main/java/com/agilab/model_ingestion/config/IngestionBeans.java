package com.agilab.model_ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.retry.support.RetryTemplate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystemException;
import java.util.List;

/**
 * Bean configuration for the ingestion pipeline.
 * Provides the retry template used around dataset reads and the compiled file map schema.
 */
@Configuration
public class IngestionBeans {

    public static final String FILE_MAP_SCHEMA = "schema/file-map.schema.json";

    /**
     * RetryTemplate for dataset reads.
     * Retries on IOException and FileSystemException, which shared and network mounts raise transiently.
     */
    @Bean
    public RetryTemplate retryTemplate(IngestionProperties properties) {
        return RetryTemplate.builder()
                .maxAttempts(properties.getRetryAttempts())
                .fixedBackoff(properties.getRetryDelay().toMillis())
                .retryOn(List.of(IOException.class, FileSystemException.class))
                .build();
    }

    @Bean
    public JsonSchema fileMapSchema(ObjectMapper objectMapper) {
        var factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
        try (var schema = new ClassPathResource(FILE_MAP_SCHEMA).getInputStream()) {
            return factory.getSchema(objectMapper.readTree(schema));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load " + FILE_MAP_SCHEMA, e);
        }
    }
}
