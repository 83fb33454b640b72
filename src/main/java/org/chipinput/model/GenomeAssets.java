package org.chipinput.model;

/**
 * Reference assets for one (species, assay category) pair. Unused assets are {@code null}.
 */
public record GenomeAssets(String genomeTsv, String chromSizes, String referenceFasta, String blacklist,
                           String blacklist2, String bowtie2IndexTar, String bwaIndexTar) {
}
