package com.agilab.model_ingestion.decode;

import com.agilab.model_ingestion.config.IngestionOptions;
import com.agilab.model_ingestion.data.EmptyDataset;
import com.agilab.model_ingestion.data.Table;
import com.agilab.model_ingestion.exception.DatasetReadException;
import com.agilab.model_ingestion.util.FileOperations;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.input.BOMInputStream;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads delimited text into an in-memory {@link Table}.
 *
 * <p>Column names are lower-cased unless {@code keep_case} is set. A file without data rows,
 * including a zero-byte file, decodes to {@link EmptyDataset#INSTANCE}.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CsvDecoder implements DatasetDecoder {

    private final FileOperations fileOperations;

    @Override
    public String formatTag() {
        return "csv";
    }

    @Override
    public Object decode(Path path, IngestionOptions options) {
        var format = csvFormat(path, options);
        var charset = charset(path, options);
        log.trace("Parsing file {}", path);
        var table = fileOperations.readWithRetry(path, file -> readTable(file, format, charset));

        if (table.rowCount() == 0) {
            log.debug("File {} is empty. Skipping it.", path);
            return EmptyDataset.INSTANCE;
        }
        return options.getBoolean(IngestionOptions.KEEP_CASE, false) ? table : table.lowercaseColumns();
    }

    private Table readTable(Path path, CSVFormat format, Charset charset) throws IOException {
        try (var input = BOMInputStream.builder().setPath(path).get();
             var reader = new InputStreamReader(input, charset);
             var parser = format.parse(reader)) {
            var columns = parser.getHeaderNames();
            var rows = new ArrayList<List<Object>>();
            for (var record : parser) {
                rows.add(toRow(record, columns.size()));
            }
            return new Table(columns, rows);
        }
    }

    // short records are padded with nulls, extra trailing cells dropped
    private static List<Object> toRow(CSVRecord record, int width) {
        var row = new ArrayList<Object>(width);
        for (int i = 0; i < width; i++) {
            row.add(i < record.size() ? CellValues.infer(record.get(i)) : null);
        }
        return row;
    }

    private static CSVFormat csvFormat(Path path, IngestionOptions options) {
        var builder = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setAllowMissingColumnNames(true)
                .setIgnoreEmptyLines(true)
                .setTrim(true);
        options.getString(IngestionOptions.DELIMITER).ifPresent(delimiter -> {
            if (delimiter.length() != 1) {
                throw new DatasetReadException(path.toString(), "Delimiter must be a single character: " + delimiter);
            }
            builder.setDelimiter(delimiter.charAt(0));
        });
        return builder.build();
    }

    private static Charset charset(Path path, IngestionOptions options) {
        var name = options.getString(IngestionOptions.CSV_FILE_ENCODING).orElse(null);
        if (name == null) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(name);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new DatasetReadException(path.toString(), "Unknown encoding " + name, e);
        }
    }
}
