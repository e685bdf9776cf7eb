package com.agilab.model_ingestion.exception;

/**
 * Thrown on a parsed-data store lookup for a logical name that was never stored.
 */
public final class UnknownDatasetException extends RuntimeException implements IngestionException {
    private final String datasetName;

    public UnknownDatasetException(String datasetName) {
        super(String.format("Key `%s` not found in parsed data.", datasetName));
        this.datasetName = datasetName;
    }

    @Override
    public String getSubject() {
        return datasetName;
    }
}
