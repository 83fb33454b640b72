package org.chipinput.model;

import java.util.Optional;

public enum PipelineType {
    TF("tf"),
    HISTONE("histone"),
    CONTROL("control");

    private final String label;

    PipelineType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Classifies an experiment from its assay and whether the catalog marks it as a control.
     * Control assays only count as controls when the control-type flag is set.
     */
    public static Optional<PipelineType> classify(AssayType assay, boolean controlTypeSet) {
        switch (assay) {
            case CONTROL_CHIP_SEQ:
            case CONTROL_MINT_CHIP_SEQ:
                return controlTypeSet ? Optional.of(CONTROL) : Optional.empty();
            case TF_CHIP_SEQ:
                return Optional.of(TF);
            case HISTONE_CHIP_SEQ:
            case MINT_CHIP_SEQ:
                return Optional.of(HISTONE);
            default:
                return Optional.empty();
        }
    }
}
