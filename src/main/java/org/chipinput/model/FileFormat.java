package org.chipinput.model;

public enum FileFormat {
    FASTQ, BAM, OTHER;

    public static FileFormat fromLabel(String label) {
        if ("fastq".equalsIgnoreCase(label)) return FASTQ;
        if ("bam".equalsIgnoreCase(label)) return BAM;
        return OTHER;
    }
}
