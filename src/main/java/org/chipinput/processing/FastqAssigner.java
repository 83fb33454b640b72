package org.chipinput.processing;

import org.chipinput.metrics.ErrorTag;
import org.chipinput.model.ExperimentRecord;
import org.chipinput.model.FileRecord;
import org.chipinput.model.MetadataSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

import static org.chipinput.model.ChipInputKeys.MAX_REPLICATES;

/**
 * Groups an experiment's usable fastqs into replicate slots by biological replicate number and
 * pairs read 1 files with their mates.
 */
public class FastqAssigner {

    private static final Logger LOGGER = Logger.getLogger(FastqAssigner.class.getName());

    private final MetadataSet metadata;

    public FastqAssigner(MetadataSet metadata) {
        this.metadata = Objects.requireNonNull(metadata);
    }

    public Resolution<ReplicateFastqs> assign(ExperimentRecord experiment, boolean forceSingleEnd) {
        final List<List<String>> r1 = ReplicateFastqs.emptySlots();
        final List<List<String>> r2 = ReplicateFastqs.emptySlots();
        final List<FileRecord> usable = new ArrayList<>();
        final List<String> missingMates = new ArrayList<>();

        for (String uri : experiment.fileUris()) {
            Optional<FileRecord> found = metadata.fileByUri(uri);
            if (found.isEmpty()) continue;
            FileRecord file = found.get();
            if (!file.isFastq() || !metadata.isUsable(file)) continue;
            usable.add(file);

            Integer rep = file.biologicalReplicate();
            if (rep == null || rep < 1 || rep > MAX_REPLICATES) {
                LOGGER.warning(String.format("%s: fastq %s has replicate number %s outside 1..%d, not assigned.",
                        experiment.accession(), file.uri(), rep, MAX_REPLICATES));
                continue;
            }
            if (file.isMate1()) {
                r1.get(rep - 1).add(file.uri());
                if (!forceSingleEnd) {
                    Optional<FileRecord> mate = Optional.ofNullable(file.pairedWith())
                            .flatMap(metadata::fileById)
                            .filter(f -> metadata.allowedStatuses().contains(f.status()));
                    if (mate.isPresent()) {
                        r2.get(rep - 1).add(mate.get().uri());
                    } else {
                        missingMates.add(file.uri());
                    }
                }
            } else if (file.isUnmated()) {
                r1.get(rep - 1).add(file.uri());
            }
        }

        ReplicateFastqs assigned = new ReplicateFastqs(r1, r2, usable);
        if (assigned.isEmpty()) {
            return Resolution.failure(experiment.accession(), ErrorTag.NoUsableFastqs,
                    "No usable fastqs were found for " + experiment.accession() + ".");
        }
        if (!missingMates.isEmpty()) {
            return Resolution.failure(experiment.accession(), ErrorTag.MissingMatePair,
                    "Metadata error (missing expected read 2 fastq) in " + experiment.accession() + " for " + missingMates + ".");
        }
        return Resolution.success(assigned.compact());
    }
}
