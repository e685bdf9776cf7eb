package com.agilab.model_ingestion.data;

import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Fully materialized table, the result of decoding a delimited text file.
 */
@EqualsAndHashCode
public final class Table implements TabularData {

    private final List<String> columns;
    private final List<List<Object>> rows;

    public Table(List<String> columns, List<List<Object>> rows) {
        this.columns = List.copyOf(columns);
        var copied = new ArrayList<List<Object>>(rows.size());
        for (var row : rows) {
            if (row.size() != columns.size()) {
                throw new IllegalArgumentException(String.format(
                        "Row has %d cells but the table has %d columns: %s", row.size(), columns.size(), row));
            }
            // cells may be null, so List.copyOf is not an option
            copied.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copied);
    }

    public static Table of(List<String> columns, Object[]... rows) {
        return new Table(columns, Arrays.stream(rows).map(Arrays::asList).toList());
    }

    @Override
    public List<String> columns() {
        return columns;
    }

    @Override
    public Stream<List<Object>> rows() {
        return rows.stream();
    }

    public List<List<Object>> rowList() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public Object value(int row, String column) {
        var index = columnIndex(column);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        return rows.get(row).get(index);
    }

    public List<Object> column(String column) {
        var index = columnIndex(column);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        return rows.stream().map(row -> row.get(index)).toList();
    }

    /**
     * Rows as column name to value maps, the shape translators feed into field dictionaries.
     */
    public List<Map<String, Object>> records() {
        return rows.stream().map(row -> {
            var fields = new LinkedHashMap<String, Object>();
            for (int i = 0; i < columns.size(); i++) {
                fields.put(columns.get(i), row.get(i));
            }
            return (Map<String, Object>) fields;
        }).toList();
    }

    public Table lowercaseColumns() {
        return new Table(columns.stream().map(c -> c.toLowerCase(Locale.ROOT)).toList(), rows);
    }

    @Override
    public Table renameColumns(Map<String, String> mapping) {
        return new Table(TabularData.renamed(columns, mapping), rows);
    }

    @Override
    public Table filterRows(Predicate<List<Object>> predicate) {
        return new Table(columns, rows.stream().filter(predicate).toList());
    }

    @Override
    public Table collect() {
        return this;
    }

    @Override
    public String toString() {
        return String.format("Table(columns=%s, rows=%d)", columns, rows.size());
    }
}
