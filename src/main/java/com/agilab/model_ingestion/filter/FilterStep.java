package com.agilab.model_ingestion.filter;

/**
 * A named, stateless transform applied to decoded data.
 *
 * <p>Steps must be total: data they do not understand, {@link com.agilab.model_ingestion.data.EmptyDataset}
 * included, is returned unchanged, and a missing option or column turns the step into a no-op.</p>
 */
public interface FilterStep {

    String name();

    Object apply(Object data, FilterContext context);
}
