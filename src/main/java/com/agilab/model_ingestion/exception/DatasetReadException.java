package com.agilab.model_ingestion.exception;

/**
 * Exception thrown when a dataset file exists but cannot be read or parsed.
 */
public final class DatasetReadException extends RuntimeException implements IngestionException {
    private final String filePath;

    public DatasetReadException(String filePath, String message, Throwable cause) {
        super(message, cause);
        this.filePath = filePath;
    }

    public DatasetReadException(String filePath, String message) {
        super(message);
        this.filePath = filePath;
    }

    @Override
    public String getSubject() {
        return filePath;
    }
}
