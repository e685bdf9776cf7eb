package com.agilab.model_ingestion.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Classifies ingestion failures and logs them with a level matching their severity.
 */
@Slf4j
@Component
public class IngestionExceptionHandler {

    public String getErrorType(IngestionException exception) {
        if (exception instanceof MissingMandatoryFileException) {
            return "MISSING_MANDATORY_FILE";
        } else if (exception instanceof UnsupportedFormatException) {
            return "UNSUPPORTED_FORMAT";
        } else if (exception instanceof DatasetReadException) {
            return "READ_ERROR";
        } else if (exception instanceof FileMapSchemaException) {
            return "SCHEMA_VIOLATION";
        } else if (exception instanceof ComponentValidationException) {
            return "VALIDATION_FAILURE";
        }
        return "UNKNOWN_DATASET";
    }

    public String getErrorSeverity(IngestionException exception) {
        if (exception instanceof UnknownDatasetException) {
            return "LOW";
        } else if (exception instanceof DatasetReadException || exception instanceof ComponentValidationException) {
            return "MEDIUM";
        }
        return "HIGH";
    }

    /**
     * Classifies any throwable raised while ingesting an entry; non-ingestion failures are reported as {@code UNEXPECTED}.
     */
    public String classify(Throwable throwable) {
        return throwable instanceof IngestionException ingestion ? getErrorType(ingestion) : "UNEXPECTED";
    }

    public void logException(String datasetName, Throwable throwable) {
        if (!(throwable instanceof IngestionException exception)) {
            log.error("[HIGH] Unexpected failure while ingesting {}", datasetName, throwable);
            return;
        }
        var severity = getErrorSeverity(exception);
        if (exception instanceof UnknownDatasetException) {
            log.warn("[{}] {} - {}", severity, datasetName, exception.getMessage());
        } else {
            log.error("[{}] {} failed for {} - {}", severity, getErrorType(exception), datasetName, exception.getMessage());
        }
    }
}
