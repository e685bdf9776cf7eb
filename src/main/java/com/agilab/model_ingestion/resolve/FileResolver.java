package com.agilab.model_ingestion.resolve;

import com.agilab.model_ingestion.config.IngestionProperties;
import com.agilab.model_ingestion.exception.MissingMandatoryFileException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds a file by name under a run folder by walking the configured search folders in order.
 *
 * <p>Each search folder is listed without descending into subfolders. Every match is collected before
 * choosing, so when copies of a file exist in several folders the first one in search order wins and a
 * single warning lists all of them.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileResolver {

    private final IngestionProperties properties;

    /**
     * @param name          file name with extension, for example {@code hierarchy.csv}
     * @param baseDirectory run folder the search folders are relative to
     * @param optional      whether a missing file is acceptable
     * @return the chosen match, or empty when an optional file is missing
     * @throws MissingMandatoryFileException when a mandatory file has no match
     */
    public Optional<Path> resolve(String name, Path baseDirectory, boolean optional) {
        var matches = findMatches(name, baseDirectory);

        if (matches.size() > 1) {
            log.warn("Multiple files found for {}. Returning first match. Check for copies of the files in {}",
                    name, matches);
        }
        if (matches.isEmpty()) {
            if (!optional) {
                throw new MissingMandatoryFileException(name, baseDirectory);
            }
            log.warn("File: '{}' not found in {}.", name, baseDirectory);
            return Optional.empty();
        }
        return Optional.of(matches.get(0));
    }

    public List<Path> searchPath(Path baseDirectory) {
        return properties.getSearchFolders().stream()
                .map(folder -> baseDirectory.resolve(folder).normalize())
                .toList();
    }

    List<Path> findMatches(String name, Path baseDirectory) {
        var matches = new ArrayList<Path>();
        for (var candidate : searchPath(baseDirectory)) {
            if (Files.isRegularFile(candidate) && hasName(candidate, name)) {
                matches.add(candidate);
            }
            if (!Files.isDirectory(candidate)) {
                continue;
            }
            // Names are compared literally, never as glob patterns
            DirectoryStream.Filter<Path> sameName = file -> hasName(file, name);
            try (DirectoryStream<Path> files = Files.newDirectoryStream(candidate, sameName)) {
                for (var file : files) {
                    if (Files.isRegularFile(file) && !matches.contains(file)) {
                        log.trace("File '{}' found in {}", name, candidate);
                        matches.add(file);
                    }
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot list " + candidate, e);
            }
        }
        return matches;
    }

    private static boolean hasName(Path path, String name) {
        return path.getFileName() != null && path.getFileName().toString().equals(name);
    }
}
