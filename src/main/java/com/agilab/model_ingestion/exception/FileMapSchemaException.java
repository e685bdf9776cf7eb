package com.agilab.model_ingestion.exception;

import java.util.List;

/**
 * Exception thrown when a file map document does not satisfy the file map schema.
 */
public final class FileMapSchemaException extends RuntimeException implements IngestionException {
    private final String source;
    private final List<String> violations;

    public FileMapSchemaException(String source, List<String> violations) {
        super(String.format("File map %s is invalid: %s", source, String.join("; ", violations)));
        this.source = source;
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }

    @Override
    public String getSubject() {
        return source;
    }
}
