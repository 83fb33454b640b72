package org.chipinput.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.chipinput.model.ChipInputKeys.*;

/**
 * Pipeline input for one experiment. Fields that do not apply to the experiment are {@code null}
 * (or empty lists); {@link #toInputJson()} leaves them out.
 *
 * @param fastqsR1 R1 fastq URIs per replicate slot, slot 1 first; always {@link ChipInputKeys#MAX_REPLICATES} entries
 * @param fastqsR2 R2 fastq URIs per replicate slot, all empty for single-ended runs
 */
public record ChipInputConfig(String title, String description, String pipelineType, boolean alignOnly,
                              boolean pairedEnd, Integer cropLength, Integer cropLengthTol,
                              GenomeAssets assets, List<String> ctlNodupBams, Boolean redactNodupBam,
                              Boolean alwaysUsePooledCtl, String aligner, Boolean useBwaMemForPe,
                              Integer bwaMemReadLenLimit, List<List<String>> fastqsR1, List<List<String>> fastqsR2,
                              String customMessage) {

    public ChipInputConfig {
        ctlNodupBams = ctlNodupBams == null ? Collections.emptyList() : List.copyOf(ctlNodupBams);
        fastqsR1 = copySlots(fastqsR1);
        fastqsR2 = copySlots(fastqsR2);
    }

    private static List<List<String>> copySlots(List<List<String>> slots) {
        List<List<String>> copy = new ArrayList<>(MAX_REPLICATES);
        for (int i = 0; i < MAX_REPLICATES; i++) {
            copy.add(slots != null && i < slots.size() && slots.get(i) != null ? List.copyOf(slots.get(i)) : List.of());
        }
        return Collections.unmodifiableList(copy);
    }

    public int replicateCount() {
        return (int) fastqsR1.stream().filter(l -> !l.isEmpty()).count();
    }

    /**
     * Ordered key/value view written as the pipeline's input JSON. Keys follow
     * {@link ChipInputKeys#KEY_ORDER}; {@code null}, empty strings and empty lists are dropped,
     * {@code false} and {@code 0} are kept.
     */
    public Map<String, Object> toInputJson() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(TITLE, title);
        values.put(DESCRIPTION, description);
        values.put(PIPELINE_TYPE, pipelineType);
        values.put(ALIGN_ONLY, alignOnly);
        values.put(PAIRED_END, pairedEnd);
        values.put(CROP_LENGTH, cropLength);
        values.put(CROP_LENGTH_TOL, cropLengthTol);
        if (assets != null) {
            values.put(GENOME_TSV, assets.genomeTsv());
            values.put(REF_FA, assets.referenceFasta());
            values.put(BOWTIE2_IDX_TAR, assets.bowtie2IndexTar());
            values.put(BWA_IDX_TAR, assets.bwaIndexTar());
            values.put(CHRSZ, assets.chromSizes());
            values.put(BLACKLIST, assets.blacklist());
            values.put(BLACKLIST2, assets.blacklist2());
        }
        values.put(CTL_NODUP_BAMS, ctlNodupBams);
        values.put(REDACT_NODUP_BAM, redactNodupBam);
        values.put(ALWAYS_USE_POOLED_CTL, alwaysUsePooledCtl);
        values.put(ALIGNER, aligner);
        values.put(USE_BWA_MEM_FOR_PE, useBwaMemForPe);
        values.put(BWA_MEM_READ_LEN_LIMIT, bwaMemReadLenLimit);
        for (int rep = 1; rep <= MAX_REPLICATES; rep++) {
            values.put(fastqsKey(rep, 1), fastqsR1.get(rep - 1));
            values.put(fastqsKey(rep, 2), fastqsR2.get(rep - 1));
        }

        Map<String, Object> ordered = new LinkedHashMap<>();
        for (String key : KEY_ORDER) {
            Object value = values.get(key);
            if (!isEmptyValue(value)) ordered.put(key, value);
        }
        return ordered;
    }

    static boolean isEmptyValue(Object value) {
        if (value == null) return true;
        if (value instanceof String) return ((String) value).isEmpty();
        if (value instanceof List) return ((List<?>) value).isEmpty();
        return false;
    }
}
