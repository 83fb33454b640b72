package org.chipinput.processing;

import org.chipinput.config.ExperimentRequest;
import org.chipinput.metrics.ErrorRecord;
import org.chipinput.metrics.ErrorTag;
import org.chipinput.metrics.ExperimentResult;
import org.chipinput.metrics.StatusHelper;
import org.chipinput.model.*;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Resolves one requested experiment end to end, stopping at the first stage that fails.
 */
public class ExperimentProcessor {

    private static final Logger LOGGER = Logger.getLogger(ExperimentProcessor.class.getName());

    private final MetadataSet metadata;
    private final ExperimentRequest request;
    private final FastqAssigner fastqAssigner;
    private final EndednessResolver endednessResolver;
    private final ControlResolver controlResolver;
    private final ControlBamMatcher controlBamMatcher;
    private final ConfigurationAssembler assembler;

    public ExperimentProcessor(MetadataSet metadata, ExperimentRequest request) {
        this.metadata = Objects.requireNonNull(metadata, "Metadata cannot be null");
        this.request = Objects.requireNonNull(request, "Request cannot be null");
        this.fastqAssigner = new FastqAssigner(metadata);
        this.endednessResolver = new EndednessResolver();
        this.controlResolver = new ControlResolver(metadata);
        this.controlBamMatcher = new ControlBamMatcher(metadata);
        this.assembler = new ConfigurationAssembler();
    }

    public ExperimentResult processExperiment() {
        final Instant start = Instant.now();
        final String accession = request.accession();
        LOGGER.fine(() -> "Processing experiment " + accession + " on thread " + Thread.currentThread().getName());

        Optional<ExperimentRecord> found = metadata.experiment(accession);
        if (found.isEmpty()) {
            return failed(ErrorRecord.of(accession, ErrorTag.ExperimentNotFound,
                    "Experiment " + accession + " is not in the experiment report."), start);
        }
        final ExperimentRecord experiment = found.get();

        Optional<AssayType> assay = AssayType.fromTitle(experiment.assayTitle());
        Optional<PipelineType> pipelineType = assay.flatMap(a -> PipelineType.classify(a, experiment.isControlTypeSet()));
        if (pipelineType.isEmpty()) {
            return failed(ErrorRecord.of(accession, ErrorTag.UnsupportedOrganismOrAssay,
                    "Cannot configure assay '" + experiment.assayTitle() + "' (control type "
                            + experiment.controlType() + ") of " + accession + "."), start);
        }

        Resolution<GenomeAssets> assets = GenomeAssetSelector.select(accession, experiment.organisms(), assay.get());
        if (!assets.isSuccess()) return failed(assets.error(), start);

        Resolution<ReplicateFastqs> fastqs = fastqAssigner.assign(experiment, request.forceSingleEnd());
        if (!fastqs.isSuccess()) return failed(fastqs.error(), start);

        Resolution<ReadProfile> profile = endednessResolver.resolve(accession, fastqs.value().usableFastqs(), request);
        if (!profile.isSuccess()) return failed(profile.error(), start);

        Resolution<ControlResolution> controls = controlResolver.resolve(experiment, pipelineType.get(), profile.value(), request);
        if (!controls.isSuccess()) return failed(controls.error(), start);

        List<String> controlBams = List.of();
        if (controls.value().needsControlBams()) {
            Resolution<List<String>> bams = controlBamMatcher.match(accession, controls.value());
            if (!bams.isSuccess()) return failed(bams.error(), start);
            controlBams = bams.value();
        }

        Resolution<ChipInputConfig> config = assembler.assemble(new ConfigurationAssembler.Stages(accession, assay.get(),
                pipelineType.get(), request, assets.value(), fastqs.value(), controls.value(), controlBams));
        if (!config.isSuccess()) return failed(config.error(), start);

        LOGGER.fine(() -> accession + " configured as " + config.value().description());
        return StatusHelper.createPassResult(config.value(), start);
    }

    private ExperimentResult failed(ErrorRecord error, Instant start) {
        LOGGER.warning(String.format("%s excluded %s: %s", error.accession(), error.tags(), String.join(" ", error.messages())));
        return StatusHelper.createFailedResult(error, start);
    }
}
