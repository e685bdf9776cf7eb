package com.agilab.model_ingestion.decode;

import com.agilab.model_ingestion.config.IngestionOptions;
import com.agilab.model_ingestion.exception.DatasetReadException;
import com.agilab.model_ingestion.exception.UnsupportedFormatException;
import io.jhdf.HdfFile;
import io.jhdf.exceptions.HdfException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Reads HDF5 tables. The layout is not self-describing, so the caller names the producing tool via the
 * {@code producer_profile} option and only profiles listed in {@link ProducerProfile} are accepted.
 */
@Slf4j
@Component
public class Hdf5Decoder implements DatasetDecoder {

    @Override
    public String formatTag() {
        return "h5";
    }

    @Override
    public Object decode(Path path, IngestionOptions options) {
        var requested = options.getString(IngestionOptions.PRODUCER_PROFILE).orElse(null);
        var profile = ProducerProfile.fromTag(requested)
                .orElseThrow(() -> new UnsupportedFormatException(path.toString(), "h5",
                        String.format("H5 file parsing is not implemented for producer profile '%s'. Supported: %s",
                                requested, supportedTags())));

        log.trace("Reading {} with the {} layout", path, profile);
        try (var file = new HdfFile(path)) {
            return profile.read(file);
        } catch (HdfException | IllegalStateException e) {
            throw new DatasetReadException(path.toString(), "Cannot read " + path + ": " + e.getMessage(), e);
        }
    }

    private static List<String> supportedTags() {
        return Arrays.stream(ProducerProfile.values()).map(ProducerProfile::getTag).toList();
    }
}
