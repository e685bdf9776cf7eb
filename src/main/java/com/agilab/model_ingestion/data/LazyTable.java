package com.agilab.model_ingestion.data;

import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Table whose rows are produced on each call to {@link #rows()}.
 * Renames and row filters are recorded and only applied when the rows are consumed.
 */
public final class LazyTable implements TabularData {

    private final List<String> columns;
    private final Supplier<Stream<List<Object>>> rowSource;

    public LazyTable(List<String> columns, Supplier<Stream<List<Object>>> rowSource) {
        this.columns = List.copyOf(columns);
        this.rowSource = rowSource;
    }

    @Override
    public List<String> columns() {
        return columns;
    }

    @Override
    public Stream<List<Object>> rows() {
        return rowSource.get();
    }

    @Override
    public LazyTable renameColumns(Map<String, String> mapping) {
        return new LazyTable(TabularData.renamed(columns, mapping), rowSource);
    }

    @Override
    public LazyTable filterRows(Predicate<List<Object>> predicate) {
        return new LazyTable(columns, () -> rowSource.get().filter(predicate));
    }

    @Override
    public String toString() {
        return "LazyTable(columns=" + columns + ")";
    }
}
