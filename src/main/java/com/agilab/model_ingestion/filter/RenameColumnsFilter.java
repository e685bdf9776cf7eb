package com.agilab.model_ingestion.filter;

import com.agilab.model_ingestion.config.IngestionOptions;
import com.agilab.model_ingestion.data.TabularData;
import org.springframework.stereotype.Component;

/**
 * Renames columns using the {@code column_mapping} option (old name to new name).
 */
@Component
public class RenameColumnsFilter implements FilterStep {

    public static final String NAME = "rename";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Object apply(Object data, FilterContext context) {
        var mapping = context.getOptions().getStringMap(IngestionOptions.COLUMN_MAPPING);
        if (!(data instanceof TabularData table) || mapping.isEmpty()) {
            return data;
        }
        return table.renameColumns(mapping);
    }
}
