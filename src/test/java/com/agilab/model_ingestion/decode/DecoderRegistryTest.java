package com.agilab.model_ingestion.decode;

import com.agilab.model_ingestion.config.IngestionOptions;
import com.agilab.model_ingestion.exception.UnsupportedFormatException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DecoderRegistryTest {

    @Mock
    private DatasetDecoder csvDecoder;

    @Mock
    private DatasetDecoder jsonDecoder;

    @TempDir
    Path tempDir;

    private DecoderRegistry registry;

    @BeforeEach
    void setUp() {
        when(csvDecoder.formatTag()).thenReturn("csv");
        when(jsonDecoder.formatTag()).thenReturn("json");
        registry = new DecoderRegistry(List.of(csvDecoder, jsonDecoder));
    }

    @Test
    void shouldDispatchByExtensionIgnoringCase() throws IOException {
        // Given
        var file = Files.writeString(tempDir.resolve("Cap.CSV"), "a\n1\n");
        when(csvDecoder.decode(file, IngestionOptions.empty())).thenReturn("decoded");

        // When
        var decoded = registry.decode(file, IngestionOptions.empty());

        // Then
        assertThat(decoded).contains("decoded");
        verify(jsonDecoder, never()).decode(any(), any());
    }

    @Test
    void shouldFailClosedOnUnknownExtension() throws IOException {
        var file = Files.writeString(tempDir.resolve("model.gdx"), "binary");

        var exception = catchThrowableOfType(() -> registry.decode(file, IngestionOptions.empty()),
                UnsupportedFormatException.class);

        assertThat(exception).hasMessageContaining("'.gdx'").hasMessageContaining("not yet supported");
        assertThat(exception.getFormat()).isEqualTo("gdx");
    }

    @Test
    void shouldSkipAbsentOptionalFileWithoutDecoding() {
        var options = IngestionOptions.of(Map.of(IngestionOptions.OPTIONAL, true));

        assertThat(registry.decode(tempDir.resolve("absent.csv"), options)).isEmpty();
        verify(csvDecoder, never()).decode(any(), any());
    }

    @Test
    void shouldReportSupportedFormats() {
        assertThat(registry.getDecoders()).containsOnlyKeys("csv", "json");
        assertThat(registry.supports(Path.of("a.json"))).isTrue();
        assertThat(registry.supports(Path.of("a.h5"))).isFalse();
    }

    @Test
    void shouldRejectTwoDecodersForTheSameFormat() {
        assertThatThrownBy(() -> new DecoderRegistry(List.of(csvDecoder, csvDecoder)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'csv'");
    }
}
