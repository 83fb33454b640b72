package org.chipinput.processing;

import org.chipinput.config.ExperimentRequest;
import org.chipinput.metrics.ErrorTag;
import org.chipinput.model.FileRecord;
import org.chipinput.model.RunType;

import java.util.*;

/**
 * Works out whether an experiment is single- or paired-ended and the read length to crop to.
 */
public class EndednessResolver {

    public Resolution<ReadProfile> resolve(String accession, List<FileRecord> usableFastqs, ExperimentRequest request) {
        final Set<String> runTypes = runTypeLabels(usableFastqs);
        final Optional<RunType> runType = endedness(runTypes, request.forceSingleEnd());
        if (runType.isEmpty()) {
            return Resolution.failure(accession, ErrorTag.IndeterminateEndedness,
                    "Could not determine endedness of " + accession + " from run types " + runTypes + ".");
        }

        if (request.cropLengthOverride().isPresent()) {
            return Resolution.success(new ReadProfile(runType.get(), request.cropLengthOverride().get(), true));
        }
        OptionalInt min = usableFastqs.stream()
                .map(FileRecord::readLength)
                .filter(Objects::nonNull)
                .mapToInt(Integer::intValue)
                .min();
        if (min.isEmpty()) {
            return Resolution.failure(accession, ErrorTag.IndeterminateEndedness,
                    "No read lengths recorded for the fastqs of " + accession + ".");
        }
        return Resolution.success(new ReadProfile(runType.get(), min.getAsInt(), false));
    }

    /**
     * Run type labels of the given files; a missing label shows up as {@code null}.
     */
    static Set<String> runTypeLabels(Collection<FileRecord> files) {
        Set<String> labels = new LinkedHashSet<>();
        for (FileRecord f : files) labels.add(f.runType());
        return labels;
    }

    /**
     * Single-ended when forced or when any label is single-ended; paired-ended when the labels are
     * all paired-ended; otherwise undetermined, including for an empty set.
     */
    static Optional<RunType> endedness(Set<String> labels, boolean forceSingleEnd) {
        if (forceSingleEnd || labels.contains(RunType.SINGLE_ENDED.label())) {
            return Optional.of(RunType.SINGLE_ENDED);
        }
        return reducesToPaired(labels) ? Optional.of(RunType.PAIRED_ENDED) : Optional.empty();
    }

    static boolean reducesToPaired(Set<String> labels) {
        return !labels.isEmpty() && labels.stream().allMatch(RunType.PAIRED_ENDED.label()::equals);
    }
}
