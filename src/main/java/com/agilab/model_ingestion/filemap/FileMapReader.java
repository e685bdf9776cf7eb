package com.agilab.model_ingestion.filemap;

import com.agilab.model_ingestion.exception.DatasetReadException;
import com.agilab.model_ingestion.exception.FileMapSchemaException;
import com.agilab.model_ingestion.util.FileOperations;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.ValidationMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reads file map documents (JSON or YAML) and user option dictionaries.
 *
 * <p>File maps are validated against {@code schema/file-map.schema.json} before use and their logical
 * names are lower-cased.</p>
 */
@Slf4j
@Component
public class FileMapReader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper jsonMapper;
    private final JsonSchema fileMapSchema;

    public FileMapReader(ObjectMapper jsonMapper, JsonSchema fileMapSchema) {
        this.jsonMapper = jsonMapper;
        this.fileMapSchema = fileMapSchema;
    }

    /**
     * @throws FileMapSchemaException when the document violates the file map schema
     * @throws IllegalArgumentException when the extension is not json, yaml or yml
     */
    public FileMap read(Path path) {
        return toFileMap(readTree(path), path.toString());
    }

    /**
     * Reads a file map given as an inline JSON object.
     */
    public FileMap readInline(String json) {
        return toFileMap(parseInline(json), "<inline>");
    }

    /**
     * Reads a user dictionary from an inline JSON object or a JSON/YAML file. No schema applies.
     */
    public Map<String, Object> readUserDict(String value) {
        var trimmed = value.strip();
        var node = trimmed.startsWith("{") || trimmed.startsWith("[") ? parseInline(trimmed) : readTree(Path.of(trimmed));
        if (!node.isObject()) {
            throw new IllegalArgumentException("User dictionary must be an object: " + value);
        }
        return jsonMapper.convertValue(node, MAP_TYPE);
    }

    private FileMap toFileMap(JsonNode document, String source) {
        var violations = fileMapSchema.validate(document);
        if (!violations.isEmpty()) {
            throw new FileMapSchemaException(source, violations.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .toList());
        }
        var descriptors = new LinkedHashMap<String, Object>();
        ((ObjectNode) document).fields().forEachRemaining(field ->
                descriptors.put(field.getKey().toLowerCase(Locale.ROOT), jsonMapper.convertValue(field.getValue(), MAP_TYPE)));
        log.debug("Read file map {} with {} entries", source, descriptors.size());
        return FileMap.fromDescriptors(descriptors);
    }

    private JsonNode parseInline(String json) {
        var trimmed = json.strip();
        if (trimmed.startsWith("[")) {
            throw new IllegalArgumentException("JSON arrays not supported for user dict.");
        }
        try {
            return jsonMapper.readTree(trimmed);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON string provided: " + e.getOriginalMessage(), e);
        }
    }

    private JsonNode readTree(Path path) {
        var extension = FileOperations.getFileExtension(path);
        var mapper = switch (extension) {
            case "json" -> jsonMapper;
            case "yaml", "yml" -> YAML_MAPPER;
            default -> throw new IllegalArgumentException(String.format(
                    "Unsupported file extension: .%s. Only .json, .yaml, and .yml are supported.", extension));
        };
        if (!Files.isRegularFile(path)) {
            throw new DatasetReadException(path.toString(), "File " + path + " not found.");
        }
        try {
            var node = mapper.readTree(path.toFile());
            // an empty YAML document reads as a missing node
            return node == null || node.isMissingNode() ? mapper.createObjectNode() : node;
        } catch (IOException e) {
            throw new DatasetReadException(path.toString(), "Error reading the file " + path + ": " + e.getMessage(), e);
        }
    }
}
