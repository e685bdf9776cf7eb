package com.agilab.model_ingestion.exception;

/**
 * Sealed hierarchy for failures raised by the ingestion pipeline.
 * Every case is an unchecked exception so that file-level errors propagate to the caller of the driver.
 */
public sealed interface IngestionException
        permits MissingMandatoryFileException, UnsupportedFormatException, DatasetReadException,
        FileMapSchemaException, ComponentValidationException, UnknownDatasetException {

    /**
     * File path, dataset name or component type the failure is about.
     */
    String getSubject();
    String getMessage();
    Throwable getCause();
}
