package com.agilab.model_ingestion.decode;

import com.agilab.model_ingestion.config.IngestionOptions;

import java.nio.file.Path;

/**
 * Decodes one file type into structured data.
 * Every Spring bean implementing this interface is registered in the {@link DecoderRegistry} at startup.
 */
public interface DatasetDecoder {

    /**
     * File extension handled by this decoder, lower case and without the dot (for example {@code csv}).
     */
    String formatTag();

    /**
     * @param path    existing file with this decoder's extension
     * @param options merged options for the dataset being read
     * @return the decoded value, never {@code null}
     */
    Object decode(Path path, IngestionOptions options);
}
