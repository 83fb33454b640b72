package org.chipinput.metrics;

/**
 * Reasons an experiment is excluded from the output. Every tag is scoped to one experiment.
 */
public enum ErrorTag {
    NoUsableFastqs,
    MissingMatePair,
    IndeterminateEndedness,
    MissingControls,
    MissingAntibodyMetadata,
    TooManyControls,
    NoWildtypeControlFound,
    NoControlBamFound,
    UntrustedTolerance,
    ControlBamMatchError,
    UnsupportedOrganismOrAssay,
    ControlNotAlignOnly,
    /** Requested accession is missing from the experiment metadata. */
    ExperimentNotFound,
    /** Resolution of the experiment threw unexpectedly. */
    ProcessingFailure
}
