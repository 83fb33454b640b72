package org.chipinput.metrics;

/**
 * Outcome of resolving one experiment.
 */
public enum Status {
    PASS, // Configuration produced
    FAIL  // Excluded, see the error record
}
