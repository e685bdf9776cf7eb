package com.agilab.model_ingestion;

import com.agilab.model_ingestion.data.ParsedDataStore;

import java.util.Optional;

/**
 * Translator for one source system: turns the datasets ingested for a scenario into its system model.
 *
 * @param <S> the system model produced
 */
public interface Ingestable<S> {

    S buildSystem(ParsedDataStore data);

    /**
     * Layout convention of the HDF5 files this source system produces, if it produces any.
     */
    default Optional<String> producerProfile() {
        return Optional.empty();
    }
}
