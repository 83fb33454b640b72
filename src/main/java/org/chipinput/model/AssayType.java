package org.chipinput.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Assay titles the input builder knows how to configure.
 */
public enum AssayType {
    TF_CHIP_SEQ("TF ChIP-seq"),
    HISTONE_CHIP_SEQ("Histone ChIP-seq"),
    MINT_CHIP_SEQ("Mint-ChIP-seq"),
    CONTROL_CHIP_SEQ("Control ChIP-seq"),
    CONTROL_MINT_CHIP_SEQ("Control Mint-ChIP-seq");

    private final String title;

    AssayType(String title) {
        this.title = title;
    }

    public String title() {
        return title;
    }

    public boolean isMint() {
        return this == MINT_CHIP_SEQ || this == CONTROL_MINT_CHIP_SEQ;
    }

    public static Optional<AssayType> fromTitle(String title) {
        return Arrays.stream(values()).filter(a -> a.title.equals(title)).findFirst();
    }
}
