package com.agilab.model_ingestion.decode;

import com.agilab.model_ingestion.data.LazyTable;
import io.jhdf.HdfFile;

import java.lang.reflect.Array;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Layout convention a producing tool uses inside an HDF5 file.
 */
public enum ProducerProfile {

    /**
     * Values in a 2-D {@code data} dataset, column names in a {@code columns} dataset.
     * The row position is exposed as a leading {@code index} column.
     */
    REEDS("reeds") {
        @Override
        LazyTable read(HdfFile file) {
            var names = toStrings(file.getDatasetByPath("columns").getData());
            var values = file.getDatasetByPath("data").getData();

            var columns = new ArrayList<String>(names.size() + 1);
            columns.add("index");
            columns.addAll(names);

            var rows = new ArrayList<List<Object>>();
            var rowCount = Array.getLength(values);
            for (int i = 0; i < rowCount; i++) {
                var row = new ArrayList<Object>(columns.size());
                row.add((long) i);
                row.addAll(cells(Array.get(values, i), names.size()));
                rows.add(row);
            }
            var frozen = List.copyOf(rows);
            return new LazyTable(columns, frozen::stream);
        }
    };

    private final String tag;

    ProducerProfile(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    abstract LazyTable read(HdfFile file);

    public static Optional<ProducerProfile> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        var normalized = tag.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(profile -> profile.tag.equals(normalized))
                .findFirst();
    }

    private static List<String> toStrings(Object data) {
        var length = Array.getLength(data);
        var result = new ArrayList<String>(length);
        for (int i = 0; i < length; i++) {
            var value = Array.get(data, i);
            result.add(value instanceof byte[] bytes ? new String(bytes, StandardCharsets.UTF_8) : String.valueOf(value));
        }
        return result;
    }

    private static List<Object> cells(Object row, int width) {
        if (!row.getClass().isArray()) {
            checkWidth(1, width);
            return List.of(row);
        }
        var length = Array.getLength(row);
        checkWidth(length, width);
        var result = new ArrayList<Object>(length);
        for (int i = 0; i < length; i++) {
            result.add(Array.get(row, i));
        }
        return result;
    }

    private static void checkWidth(int length, int width) {
        if (length != width) {
            throw new IllegalStateException(String.format("Row has %d values but %d column names", length, width));
        }
    }
}
