package com.agilab.model_ingestion.construct;

import com.agilab.model_ingestion.exception.ComponentValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.lang.reflect.RecordComponent;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Builds domain components from loosely typed field dictionaries.
 *
 * <p>Null values and names that are not properties of the target type are dropped first. The remaining
 * values are bound with Jackson and checked with Jakarta Bean Validation. Callers that prefer a
 * best-effort component over a failure can opt into unchecked construction, which skips validation.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ValidatedConstructor {

    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final Map<Class<?>, Set<String>> fieldNamesCache = new ConcurrentHashMap<>();

    /**
     * Strict construction.
     *
     * @throws ComponentValidationException when the values cannot be bound or violate a constraint
     */
    public <T> T construct(Class<T> type, Map<String, ?> fieldValues) {
        return construct(type, fieldValues, false);
    }

    /**
     * @param allowUnchecked when strict construction fails, return an unvalidated component instead of throwing
     * @throws ComponentValidationException when strict construction fails and {@code allowUnchecked} is false
     */
    public <T> T construct(Class<T> type, Map<String, ?> fieldValues, boolean allowUnchecked) {
        var fields = validFields(type, fieldValues);
        try {
            return constructStrict(type, fields);
        } catch (ComponentValidationException e) {
            if (!allowUnchecked) {
                throw e;
            }
            log.warn("Validation of {} failed, constructing it unchecked: {}", type.getSimpleName(), e.getViolations());
            return constructUnchecked(type, fields);
        }
    }

    /**
     * Names Jackson can bind on the type: record components, or settable bean properties.
     */
    public Set<String> fieldNames(Class<?> type) {
        return fieldNamesCache.computeIfAbsent(type, this::introspectFieldNames);
    }

    Map<String, Object> validFields(Class<?> type, Map<String, ?> fieldValues) {
        var known = fieldNames(type);
        var fields = new LinkedHashMap<String, Object>();
        fieldValues.forEach((name, value) -> {
            if (value != null && known.contains(name)) {
                fields.put(name, value);
            }
        });
        return fields;
    }

    private <T> T constructStrict(Class<T> type, Map<String, Object> fields) {
        T component;
        try {
            component = objectMapper.convertValue(fields, type);
        } catch (IllegalArgumentException e) {
            throw new ComponentValidationException(type, e.getMessage(), e);
        }
        var violations = validator.validate(component);
        if (!violations.isEmpty()) {
            throw new ComponentValidationException(type, violations);
        }
        return component;
    }

    // Values that violate constraints are kept as they are; only values Jackson cannot bind at all are dropped.
    private <T> T constructUnchecked(Class<T> type, Map<String, Object> fields) {
        try {
            return objectMapper.convertValue(fields, type);
        } catch (IllegalArgumentException e) {
            var bindable = new LinkedHashMap<String, Object>();
            fields.forEach((name, value) -> {
                if (canBind(type, name, value)) {
                    bindable.put(name, value);
                } else {
                    log.warn("Dropping field {}={} of {}: value cannot be bound", name, value, type.getSimpleName());
                }
            });
            return objectMapper.convertValue(bindable, type);
        }
    }

    private boolean canBind(Class<?> type, String name, Object value) {
        try {
            objectMapper.convertValue(Map.of(name, value), type);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private Set<String> introspectFieldNames(Class<?> type) {
        if (type.isRecord()) {
            return Arrays.stream(type.getRecordComponents())
                    .map(RecordComponent::getName)
                    .collect(Collectors.toUnmodifiableSet());
        }
        var description = objectMapper.getDeserializationConfig().introspect(objectMapper.constructType(type));
        return description.findProperties().stream()
                .filter(BeanPropertyDefinition::couldDeserialize)
                .map(BeanPropertyDefinition::getName)
                .collect(Collectors.toUnmodifiableSet());
    }
}
