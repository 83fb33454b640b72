package org.chipinput.metrics;

import org.chipinput.model.ChipInputConfig;

import java.time.Duration;

/**
 * Result of resolving one experiment on one worker: a configuration on PASS, an error record on FAIL.
 */
public record ExperimentResult(String accession, Status status, ChipInputConfig config, ErrorRecord error,
                               Duration duration, String threadName) implements HasStatus {
}
