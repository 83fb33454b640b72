package org.chipinput.config;

import java.util.Objects;
import java.util.Optional;

/**
 * One row of the request table: an accession plus its per-experiment overrides.
 */
public record ExperimentRequest(String accession, boolean alignOnly, String customMessage, Integer customCropLength,
                                boolean multipleControls, boolean forceSingleEnd, boolean redacted) {
    public ExperimentRequest {
        Objects.requireNonNull(accession, "accession");
        if (customMessage == null) customMessage = "";
        if (customCropLength != null && customCropLength < 1) {
            throw new IllegalArgumentException("Custom crop length must be positive for " + accession + ": " + customCropLength);
        }
    }

    public static ExperimentRequest of(String accession, boolean alignOnly) {
        return new ExperimentRequest(accession, alignOnly, "", null, false, false, false);
    }

    public Optional<Integer> cropLengthOverride() {
        return Optional.ofNullable(customCropLength);
    }
}
