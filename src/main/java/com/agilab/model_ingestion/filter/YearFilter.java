package com.agilab.model_ingestion.filter;

import com.agilab.model_ingestion.config.IngestionOptions;
import com.agilab.model_ingestion.data.TabularData;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Keeps the rows of the solve year.
 *
 * <p>The year comes from {@code solve_year}, falling back to {@code year}; the column from
 * {@code year_column}, default {@code year}. Without a year option or a year column the data passes through.
 * A year option that is not an integer counts as absent.</p>
 */
@Slf4j
@Component
public class YearFilter implements FilterStep {

    public static final String NAME = "filter_year";
    static final String DEFAULT_YEAR_COLUMN = "year";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Object apply(Object data, FilterContext context) {
        var options = context.getOptions();
        var year = solveYear(options);
        if (!(data instanceof TabularData table) || year.isEmpty()) {
            return data;
        }
        var column = options.getString(IngestionOptions.YEAR_COLUMN).orElse(DEFAULT_YEAR_COLUMN);
        var index = table.columnIndex(column);
        if (index < 0) {
            return data;
        }
        int target = year.get();
        return table.filterRows(row -> matches(row.get(index), target));
    }

    private static Optional<Integer> solveYear(IngestionOptions options) {
        return yearOption(options, IngestionOptions.SOLVE_YEAR)
                .or(() -> yearOption(options, IngestionOptions.YEAR));
    }

    private static Optional<Integer> yearOption(IngestionOptions options, String key) {
        try {
            return options.getInteger(key);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private static boolean matches(Object cell, int year) {
        if (cell instanceof Number number) {
            return number.doubleValue() == year;
        }
        return cell != null && cell.toString().trim().equals(Integer.toString(year));
    }
}
