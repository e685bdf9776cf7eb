package com.agilab.model_ingestion.integration;

import com.agilab.model_ingestion.Ingestable;
import com.agilab.model_ingestion.ModelIngestionService;
import com.agilab.model_ingestion.ModelScenario;
import com.agilab.model_ingestion.construct.ValidatedConstructor;
import com.agilab.model_ingestion.data.ParsedDataStore;
import com.agilab.model_ingestion.data.Table;
import com.agilab.model_ingestion.event.DatasetLoadedEvent;
import com.agilab.model_ingestion.event.DatasetSkippedEvent;
import com.agilab.model_ingestion.exception.FileMapSchemaException;
import com.agilab.model_ingestion.filemap.FileMapReader;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.event.ApplicationEvents;
import org.springframework.test.context.event.RecordApplicationEvents;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Reads a file map, ingests a run folder and translates the datasets into components, with the full
 * application context.
 */
@SpringBootTest
@RecordApplicationEvents
@TestPropertySource(properties = {
        "model-ingestion.retry-attempts=2",
        "model-ingestion.retry-delay=PT0.01S"
})
class ModelIngestionIntegrationTest {

    record Generator(@NotBlank String technology, String region, Long year, @PositiveOrZero Double value) {
    }

    @Autowired
    private ModelIngestionService ingestionService;

    @Autowired
    private FileMapReader fileMapReader;

    @Autowired
    private ValidatedConstructor validatedConstructor;

    @Autowired
    private ApplicationEvents applicationEvents;

    @TempDir
    Path tempDir;

    private Path runFolder;

    @BeforeEach
    void setUp() throws IOException {
        runFolder = tempDir.resolve("run");
        write("outputs/cap.csv", "Tech,Region,Year,Value\nwind,p1,2030,10\nwind,p1,2035,12\nsolar,p2,2030,4\n");
        write("inputs_case/supplycurve_metadata/rev_paths.csv", "sc_point_gid,tech\n1,wind\n");
        write("file_map.yaml", """
                capacity:
                  fname: cap.csv
                  column_mapping:
                    tech: technology
                supply_curve:
                  fname: rev_paths.csv
                prices:
                  fname: prices.csv
                  optional: true
                """);
    }

    @Test
    void shouldIngestRunFolderAndBuildSystem() {
        // Given
        var scenario = ModelScenario.builder()
                .name("base")
                .inputModel("reeds-US")
                .runFolder(runFolder)
                .fileMap(fileMapReader.read(runFolder.resolve("file_map.yaml")))
                .inputOption("solve_year", 2030)
                .build();
        Ingestable<List<Generator>> translator = this::generators;

        // When
        var parsed = ingestionService.parse(scenario, translator);
        var system = parsed.buildSystem();

        // Then - default reeds-US filters renamed the column and kept the solve year
        assertThat(system).containsExactly(
                new Generator("wind", "p1", 2030L, 10.0),
                new Generator("solar", "p2", 2030L, 4.0));
        assertThat(parsed.store().names()).containsExactly("capacity", "supply_curve");
        assertThat(parsed.fileMapWithResolvedPaths().get("supply_curve").orElseThrow().getPinnedPath())
                .contains(runFolder.resolve("inputs_case/supplycurve_metadata/rev_paths.csv"));
        assertThat(applicationEvents.stream(DatasetLoadedEvent.class).count()).isEqualTo(2);
        assertThat(applicationEvents.stream(DatasetSkippedEvent.class))
                .extracting(DatasetSkippedEvent::getDatasetName)
                .containsExactly("prices");
    }

    @Test
    void shouldApplyUserOverridesToFileMap() {
        // Given
        var overrides = fileMapReader.readUserDict("{\"prices\": {\"_replace\": true, \"fname\": \"cap.csv\"}}");
        var fileMap = fileMapReader.read(runFolder.resolve("file_map.yaml")).withOverrides(overrides);
        var scenario = ModelScenario.builder().name("override").runFolder(runFolder).fileMap(fileMap).build();

        // When
        var parsed = ingestionService.parse(scenario, ParsedDataStore::names);

        // Then - no input model, so no default filters
        assertThat(parsed.store().get("prices", Table.class).rowCount()).isEqualTo(3);
        assertThat(fileMap.get("prices").orElseThrow().isOptional()).isFalse();
    }

    @Test
    void shouldRejectInvalidFileMapBeforeIngestion() throws IOException {
        var invalid = write("bad_map.json", "{\"capacity\": {\"fname\": 42}}");

        assertThatThrownBy(() -> fileMapReader.read(invalid)).isInstanceOf(FileMapSchemaException.class);
    }

    private List<Generator> generators(ParsedDataStore data) {
        return data.get("capacity", Table.class).records().stream()
                .map(fields -> validatedConstructor.construct(Generator.class, fields))
                .toList();
    }

    private Path write(String relative, String content) throws IOException {
        var file = runFolder.resolve(relative);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content);
    }
}
