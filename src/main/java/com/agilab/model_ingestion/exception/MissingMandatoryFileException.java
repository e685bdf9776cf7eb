package com.agilab.model_ingestion.exception;

import java.nio.file.Path;

/**
 * Thrown when a file map entry that is not optional cannot be found under any search folder.
 */
public final class MissingMandatoryFileException extends RuntimeException implements IngestionException {
    private final String fileName;
    private final Path baseDirectory;

    public MissingMandatoryFileException(String fileName, Path baseDirectory) {
        super(String.format("Mandatory file '%s' not found in %s.", fileName, baseDirectory));
        this.fileName = fileName;
        this.baseDirectory = baseDirectory;
    }

    public String getFileName() {
        return fileName;
    }

    public Path getBaseDirectory() {
        return baseDirectory;
    }

    @Override
    public String getSubject() {
        return fileName;
    }
}
