package org.chipinput.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keys of the pipeline input JSON.
 */
public interface ChipInputKeys {
    String TITLE = "chip.title";
    String DESCRIPTION = "chip.description";
    String PIPELINE_TYPE = "chip.pipeline_type";
    String ALIGN_ONLY = "chip.align_only";
    String PAIRED_END = "chip.paired_end";
    /** Read length every fastq is cropped to before alignment. */
    String CROP_LENGTH = "chip.crop_length";
    String CROP_LENGTH_TOL = "chip.crop_length_tol";
    String GENOME_TSV = "chip.genome_tsv";
    String REF_FA = "chip.ref_fa";
    String BOWTIE2_IDX_TAR = "chip.bowtie2_idx_tar";
    String BWA_IDX_TAR = "chip.bwa_idx_tar";
    String CHRSZ = "chip.chrsz";
    String BLACKLIST = "chip.blacklist";
    String BLACKLIST2 = "chip.blacklist2";
    /** Filtered, deduplicated control alignments. */
    String CTL_NODUP_BAMS = "chip.ctl_nodup_bams";
    String REDACT_NODUP_BAM = "chip.redact_nodup_bam";
    String ALWAYS_USE_POOLED_CTL = "chip.always_use_pooled_ctl";
    String ALIGNER = "chip.aligner";
    String USE_BWA_MEM_FOR_PE = "chip.use_bwa_mem_for_pe";
    String BWA_MEM_READ_LEN_LIMIT = "chip.bwa_mem_read_len_limit";

    int MAX_REPLICATES = 10;

    static String fastqsKey(int replicate, int read) {
        return "chip.fastqs_rep" + replicate + "_R" + read;
    }

    /**
     * Canonical key order of an input JSON. Consumers diff these files, so the order is fixed.
     */
    List<String> KEY_ORDER = canonicalOrder();

    private static List<String> canonicalOrder() {
        List<String> keys = new ArrayList<>(List.of(
                TITLE, DESCRIPTION, PIPELINE_TYPE, ALIGN_ONLY, PAIRED_END, CROP_LENGTH, CROP_LENGTH_TOL,
                GENOME_TSV, REF_FA, BOWTIE2_IDX_TAR, BWA_IDX_TAR, CHRSZ, BLACKLIST, BLACKLIST2,
                CTL_NODUP_BAMS, REDACT_NODUP_BAM, ALWAYS_USE_POOLED_CTL, ALIGNER, USE_BWA_MEM_FOR_PE,
                BWA_MEM_READ_LEN_LIMIT));
        for (int rep = 1; rep <= MAX_REPLICATES; rep++) {
            keys.add(fastqsKey(rep, 1));
            keys.add(fastqsKey(rep, 2));
        }
        return Collections.unmodifiableList(keys);
    }
}
