package org.chipinput.processing;

import org.chipinput.metrics.ErrorRecord;
import org.chipinput.metrics.ErrorTag;
import org.chipinput.model.FileRecord;
import org.chipinput.model.MetadataSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static org.chipinput.model.ChipInputKeys.MAX_REPLICATES;

/**
 * Finds the pre-aligned control bams matching a resolved control set: one bam per control replicate,
 * mapped with the combined run type and cropped to within {@link #TOLERANCE_BP} of the combined
 * minimum read length.
 */
public class ControlBamMatcher {

    public static final int TOLERANCE_BP = 2;

    private final MetadataSet metadata;

    public ControlBamMatcher(MetadataSet metadata) {
        this.metadata = Objects.requireNonNull(metadata);
    }

    /**
     * Every control must contribute at least one bam and every matched bam must have been cropped
     * with a tolerance of exactly {@link #TOLERANCE_BP}; a bam with any other tolerance still counts
     * as found but makes the whole match fail.
     */
    public Resolution<List<String>> match(String accession, ControlResolution resolution) {
        final List<String> bams = new ArrayList<>();
        final List<ErrorTag> tags = new ArrayList<>();
        final List<String> messages = new ArrayList<>();
        boolean untrusted = false;

        for (String control : resolution.controls()) {
            boolean matchingBamFound = false;
            for (int rep = 1; rep <= MAX_REPLICATES; rep++) {
                Optional<FileRecord> bam = findBam(control, rep, resolution);
                if (bam.isEmpty()) continue;
                matchingBamFound = true;
                Integer tolerance = bam.get().croppedReadLengthTolerance();
                if (tolerance != null && tolerance == TOLERANCE_BP) {
                    bams.add(bam.get().uri());
                } else {
                    untrusted = true;
                    tags.add(ErrorTag.UntrustedTolerance);
                    messages.add("Tolerance of control bam " + bam.get().id() + " is " + tolerance + ", not " + TOLERANCE_BP + " bp.");
                }
            }
            if (!matchingBamFound) {
                tags.add(ErrorTag.NoControlBamFound);
                messages.add("No bams found in control " + control + " of " + accession + ".");
            }
        }

        if (bams.isEmpty() || untrusted) {
            tags.add(ErrorTag.ControlBamMatchError);
            messages.add(bams.isEmpty() ? "No usable control bams found for " + accession + "."
                    : "Control bams of " + accession + " include an untrusted alignment.");
        }
        if (!tags.isEmpty()) {
            return Resolution.failure(new ErrorRecord(accession, tags, messages));
        }
        return Resolution.success(bams);
    }

    private Optional<FileRecord> findBam(String control, int replicate, ControlResolution resolution) {
        final int target = resolution.combinedMinReadLength();
        for (FileRecord f : metadata.files()) {
            if (f.isBam()
                    && control.equals(f.dataset())
                    && Integer.valueOf(replicate).equals(f.biologicalReplicate())
                    && metadata.allowedStatuses().contains(f.status())
                    && resolution.combinedRunType().label().equals(f.mappedRunType())
                    && f.croppedReadLength() != null
                    && Math.abs(f.croppedReadLength() - target) <= TOLERANCE_BP) {
                return Optional.of(f);
            }
        }
        return Optional.empty();
    }
}
