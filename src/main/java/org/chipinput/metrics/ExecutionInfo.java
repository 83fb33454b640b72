package org.chipinput.metrics;

import org.chipinput.model.ChipInputConfig;

import java.time.Duration;
import java.util.SortedMap;

/**
 * Merged outcome of one run. Both maps are keyed and sorted by accession; an accession appears in
 * at most one of them.
 */
public record ExecutionInfo(Duration totalDuration, SortedMap<String, ChipInputConfig> configs,
                            SortedMap<String, ErrorRecord> errors) {

    public int experimentCount() {
        return configs.size() + errors.size();
    }
}
