package com.agilab.model_ingestion.util;

import com.agilab.model_ingestion.config.IngestionProperties;
import com.agilab.model_ingestion.exception.DatasetReadException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

@Slf4j
@RequiredArgsConstructor
@Component
public class FileOperations {

    private final RetryTemplate retryTemplate;
    private final IngestionProperties properties;

    @FunctionalInterface
    public interface FileReader<T> {
        T read(Path path) throws IOException;
    }

    /**
     * Runs {@code reader} against the file, retrying on I/O failures.
     *
     * @throws DatasetReadException when the read still fails after the configured attempts
     */
    public <T> T readWithRetry(Path path, FileReader<T> reader) {
        try {
            return retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.debug("Retrying read of {} (attempt {})", path, context.getRetryCount() + 1);
                }
                return reader.read(path);
            });
        } catch (IOException e) {
            log.error("Failed to read file after {} attempts: {}", properties.getRetryAttempts(), path);
            throw new DatasetReadException(path.toString(), "Cannot read " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * @return the lower-case extension without the dot, or an empty string
     */
    public static String getFileExtension(Path path) {
        var fileName = path.getFileName();
        return fileName == null ? "" : FilenameUtils.getExtension(fileName.toString()).toLowerCase(Locale.ROOT);
    }

}
