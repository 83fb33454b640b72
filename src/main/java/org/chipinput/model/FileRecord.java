package org.chipinput.model;

/**
 * Catalog view of one fastq or bam file. Fastq-only and bam-only fields are {@code null}
 * for the other format.
 */
public record FileRecord(String id, String uri, String dataset, FileFormat format, String status,
                         String replicateStatus, Integer biologicalReplicate,
                         String pairedEnd, String pairedWith, String runType, Integer readLength,
                         String mappedRunType, Integer croppedReadLength, Integer croppedReadLengthTolerance) {

    public static final String MATE_1 = "1";

    public boolean isFastq() {
        return format == FileFormat.FASTQ;
    }

    public boolean isBam() {
        return format == FileFormat.BAM;
    }

    public boolean isMate1() {
        return MATE_1.equals(pairedEnd);
    }

    public boolean isUnmated() {
        return pairedEnd == null || pairedEnd.isBlank();
    }
}
