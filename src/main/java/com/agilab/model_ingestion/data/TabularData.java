package com.agilab.model_ingestion.data;

import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Column-named rows, either held in memory ({@link Table}) or produced on demand ({@link LazyTable}).
 * Transformations return a new instance of the same kind and never modify the receiver.
 */
public interface TabularData {

    List<String> columns();

    /**
     * Rows in file order. Each row has one cell per column; empty cells are {@code null}.
     */
    Stream<List<Object>> rows();

    TabularData renameColumns(Map<String, String> mapping);

    TabularData filterRows(Predicate<List<Object>> predicate);

    /**
     * @return position of the column, or -1 when the table has no such column
     */
    default int columnIndex(String column) {
        return columns().indexOf(column);
    }

    default Table collect() {
        return new Table(columns(), rows().toList());
    }

    static List<String> renamed(List<String> columns, Map<String, String> mapping) {
        return columns.stream()
                .map(column -> mapping.getOrDefault(column, column))
                .toList();
    }
}
