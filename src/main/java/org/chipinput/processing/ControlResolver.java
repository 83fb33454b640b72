package org.chipinput.processing;

import org.chipinput.config.ExperimentRequest;
import org.chipinput.metrics.ErrorTag;
import org.chipinput.model.*;

import java.util.*;
import java.util.logging.Logger;

/**
 * Chooses the control dataset(s) of an experiment and combines the experiment's endedness and read
 * length with those of its controls.
 * <p>
 * Experiments listing several possible controls are rejected unless the request asks for multiple
 * controls, except for eGFP-tagged TF ChIP-seq, which uses the listed wildtype control.
 */
public class ControlResolver {

    private static final Logger LOGGER = Logger.getLogger(ControlResolver.class.getName());

    /** Antibody target of eGFP-tagged TF ChIP-seq. */
    public static final String EGFP_TARGET = "/targets/eGFP-avictoria/";

    private final MetadataSet metadata;

    public ControlResolver(MetadataSet metadata) {
        this.metadata = Objects.requireNonNull(metadata);
    }

    public Resolution<ControlResolution> resolve(ExperimentRecord experiment, PipelineType pipelineType,
                                                 ReadProfile profile, ExperimentRequest request) {
        final String accession = experiment.accession();

        if (pipelineType == PipelineType.CONTROL) {
            RunType runType = request.forceSingleEnd() ? RunType.SINGLE_ENDED : profile.runType();
            return Resolution.success(new ControlResolution(List.of(), runType, profile.minReadLength(), profile.minReadLength()));
        }

        List<String> controls = experiment.possibleControls();
        if (controls.isEmpty()) {
            return Resolution.failure(accession, ErrorTag.MissingControls,
                    "No controls in possible_controls for experiment " + accession + ".");
        }

        if (controls.size() > 1 && !request.multipleControls()) {
            Resolution<List<String>> narrowed = narrowToSingleControl(experiment, pipelineType);
            if (!narrowed.isSuccess()) return Resolution.failure(narrowed.error());
            controls = narrowed.value();
        }

        return combine(experiment, controls, profile, request);
    }

    private Resolution<List<String>> narrowToSingleControl(ExperimentRecord experiment, PipelineType pipelineType) {
        final String accession = experiment.accession();
        final Set<String> targets = new LinkedHashSet<>();
        for (ReplicateRecord rep : experiment.replicates()) {
            if (!rep.hasAntibody()) {
                return Resolution.failure(accession, ErrorTag.MissingAntibodyMetadata,
                        "Replicate in " + accession + " is missing metadata about the antibody used.");
            }
            targets.addAll(rep.antibodyTargets());
        }

        if (!(targets.equals(Set.of(EGFP_TARGET)) && pipelineType == PipelineType.TF)) {
            return Resolution.failure(accession, ErrorTag.TooManyControls,
                    "Too many controls for experiment " + accession + ": " + experiment.possibleControls() + ".");
        }
        for (String control : experiment.possibleControls()) {
            if (metadata.isWildtypeControl(control)) {
                LOGGER.fine(() -> accession + ": eGFP experiment narrowed to wildtype control " + control);
                return Resolution.success(List.of(control));
            }
        }
        return Resolution.failure(accession, ErrorTag.NoWildtypeControlFound,
                "Could not locate wildtype control for " + accession + " among " + experiment.possibleControls() + ".");
    }

    private Resolution<ControlResolution> combine(ExperimentRecord experiment, List<String> controls,
                                                  ReadProfile profile, ExperimentRequest request) {
        final Set<String> controlRunTypes = new LinkedHashSet<>();
        final List<Integer> controlReadLengths = new ArrayList<>();
        for (String control : controls) {
            List<FileRecord> fastqs = metadata.usableFastqsOfDataset(control);
            controlRunTypes.addAll(EndednessResolver.runTypeLabels(fastqs));
            fastqs.stream().map(FileRecord::readLength).filter(Objects::nonNull).forEach(controlReadLengths::add);
        }

        final RunType combinedRunType;
        if (controlRunTypes.contains(RunType.SINGLE_ENDED.label())
                || profile.runType() == RunType.SINGLE_ENDED
                || request.forceSingleEnd()) {
            combinedRunType = RunType.SINGLE_ENDED;
        } else if (EndednessResolver.reducesToPaired(controlRunTypes) && profile.runType() == RunType.PAIRED_ENDED) {
            combinedRunType = RunType.PAIRED_ENDED;
        } else {
            return Resolution.failure(experiment.accession(), ErrorTag.IndeterminateEndedness,
                    "Could not determine correct endedness for experiment " + experiment.accession()
                            + " and its control(s) " + controls + " (control run types " + controlRunTypes + ").");
        }

        int combinedMin = profile.minReadLength();
        for (int length : controlReadLengths) combinedMin = Math.min(combinedMin, length);
        int cropLength = profile.cropOverridden() ? profile.minReadLength() : combinedMin;

        return Resolution.success(new ControlResolution(controls, combinedRunType, combinedMin, cropLength));
    }
}
