package com.agilab.model_ingestion.exception;

import jakarta.validation.ConstraintViolation;

import java.util.List;
import java.util.Set;

/**
 * Exception thrown when a component cannot be built from its field values under strict validation.
 */
public final class ComponentValidationException extends RuntimeException implements IngestionException {
    private final Class<?> componentType;
    private final List<String> violations;

    public ComponentValidationException(Class<?> componentType, Set<? extends ConstraintViolation<?>> violations) {
        this(componentType, violations.stream()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .sorted()
                .toList());
    }

    public ComponentValidationException(Class<?> componentType, List<String> violations) {
        super(String.format("Invalid %s: %s", componentType.getSimpleName(), String.join("; ", violations)));
        this.componentType = componentType;
        this.violations = List.copyOf(violations);
    }

    public ComponentValidationException(Class<?> componentType, String message, Throwable cause) {
        super(String.format("Invalid %s: %s", componentType.getSimpleName(), message), cause);
        this.componentType = componentType;
        this.violations = List.of(message);
    }

    public Class<?> getComponentType() {
        return componentType;
    }

    public List<String> getViolations() {
        return violations;
    }

    @Override
    public String getSubject() {
        return componentType.getName();
    }
}
