package com.agilab.model_ingestion.construct;

import com.agilab.model_ingestion.exception.ComponentValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class ValidatedConstructorTest {

    record Sample(@Positive int a, String b) {
    }

    record Generator(@NotBlank String name, @Min(0) double capacity) {
    }

    @Data
    static class Bus {
        @NotBlank
        private String name;
        private Double voltage;
    }

    private static ValidatorFactory validatorFactory;

    private ValidatedConstructor constructor;

    @BeforeAll
    static void createValidatorFactory() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
    }

    @AfterAll
    static void closeValidatorFactory() {
        validatorFactory.close();
    }

    @BeforeEach
    void setUp() {
        constructor = new ValidatedConstructor(new ObjectMapper(), validatorFactory.getValidator());
    }

    @Test
    void shouldDropNullsAndUnknownFields() {
        // Given
        var fields = new HashMap<String, Object>();
        fields.put("a", 1);
        fields.put("b", null);
        fields.put("z", 5);

        // When
        var sample = constructor.construct(Sample.class, fields);

        // Then
        assertThat(sample).isEqualTo(new Sample(1, null));
    }

    @Test
    void shouldRaiseValidationFailureWithViolations() {
        var fields = Map.<String, Object>of("name", "gas-1", "capacity", -5.0);

        assertThatThrownBy(() -> constructor.construct(Generator.class, fields))
                .isInstanceOf(ComponentValidationException.class)
                .hasMessageContaining("capacity");
    }

    @Test
    void shouldNameComponentTypeAndViolatedProperty() {
        var fields = Map.<String, Object>of("name", "gas-1", "capacity", -5.0);

        var exception = catchThrowableOfType(() -> constructor.construct(Generator.class, fields),
                ComponentValidationException.class);

        assertThat(exception.getComponentType()).isEqualTo(Generator.class);
        assertThat(exception.getViolations()).hasSize(1);
        assertThat(exception.getViolations().get(0)).startsWith("capacity: ");
    }

    @Test
    void shouldCarryInvalidValuesWhenUncheckedIsAllowed() {
        var fields = Map.<String, Object>of("name", "gas-1", "capacity", -5.0);

        var generator = constructor.construct(Generator.class, fields, true);

        assertThat(generator).isEqualTo(new Generator("gas-1", -5.0));
    }

    @Test
    void shouldDropUnbindableFieldsWhenUncheckedIsAllowed() {
        var fields = Map.<String, Object>of("name", "gas-1", "capacity", "lots");

        assertThatThrownBy(() -> constructor.construct(Generator.class, fields))
                .isInstanceOf(ComponentValidationException.class);
        assertThat(constructor.construct(Generator.class, fields, true)).isEqualTo(new Generator("gas-1", 0.0));
    }

    @Test
    void shouldBuildAndValidateBeans() {
        var bus = constructor.construct(Bus.class, Map.of("name", "b1", "voltage", 230, "zone", "z1"));

        assertThat(bus.getName()).isEqualTo("b1");
        assertThat(bus.getVoltage()).isEqualTo(230.0);
        assertThatThrownBy(() -> constructor.construct(Bus.class, Map.of("voltage", 230)))
                .isInstanceOf(ComponentValidationException.class)
                .hasMessageStartingWith("Invalid Bus");
    }

    @Test
    void shouldListBindableFieldNames() {
        assertThat(constructor.fieldNames(Sample.class)).containsExactlyInAnyOrder("a", "b");
        assertThat(constructor.fieldNames(Bus.class)).containsExactlyInAnyOrder("name", "voltage");
    }
}
