package com.agilab.model_ingestion.exception;

/**
 * Thrown when no decoder is registered for a file type, or when a decoder does not support
 * the producer profile it was asked to read.
 */
public final class UnsupportedFormatException extends RuntimeException implements IngestionException {
    private final String filePath;
    private final String format;

    public UnsupportedFormatException(String filePath, String format, String message) {
        super(message);
        this.filePath = filePath;
        this.format = format;
    }

    public String getFormat() {
        return format;
    }

    @Override
    public String getSubject() {
        return filePath;
    }
}
