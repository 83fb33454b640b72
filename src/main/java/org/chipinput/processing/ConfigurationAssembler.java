package org.chipinput.processing;

import org.chipinput.config.ExperimentRequest;
import org.chipinput.metrics.ErrorTag;
import org.chipinput.model.AssayType;
import org.chipinput.model.ChipInputConfig;
import org.chipinput.model.GenomeAssets;
import org.chipinput.model.PipelineType;

import java.util.List;

/**
 * Builds the pipeline input of one experiment from the outcome of the earlier stages.
 */
public class ConfigurationAssembler {

    public static final int CROP_LENGTH_TOLERANCE = 2;
    public static final String MINT_ALIGNER = "bwa";

    /**
     * Everything resolved for one experiment.
     *
     * @param controlBams matched control bams; empty for control experiments
     */
    public record Stages(String accession, AssayType assay, PipelineType pipelineType, ExperimentRequest request,
                         GenomeAssets assets, ReplicateFastqs fastqs, ControlResolution controls,
                         List<String> controlBams) {
    }

    public Resolution<ChipInputConfig> assemble(Stages stages) {
        final ExperimentRequest request = stages.request();
        final boolean control = stages.pipelineType() == PipelineType.CONTROL;
        if (control && !request.alignOnly()) {
            return Resolution.failure(stages.accession(), ErrorTag.ControlNotAlignOnly,
                    stages.accession() + " is a control but was not align_only.");
        }

        final boolean mint = stages.assay().isMint();
        final boolean paired = stages.controls().combinedRunType().isPaired();
        final int cropLength = stages.controls().cropLength();
        final ReplicateFastqs fastqs = stages.fastqs();

        final String description = describe(stages.accession(), paired, mint ? null : cropLength,
                fastqs.replicateCount(), stages.pipelineType(), request.alignOnly());

        return Resolution.success(new ChipInputConfig(
                stages.accession(),
                description,
                stages.pipelineType().label(),
                request.alignOnly(),
                paired,
                mint ? null : cropLength,
                mint ? null : CROP_LENGTH_TOLERANCE,
                stages.assets(),
                control ? List.of() : stages.controlBams(),
                request.redacted() ? Boolean.TRUE : null,
                control ? null : Boolean.TRUE,
                mint ? MINT_ALIGNER : null,
                mint ? Boolean.TRUE : null,
                mint ? 0 : null,
                fastqs.r1(),
                paired ? fastqs.r2() : null,
                request.customMessage()));
    }

    /**
     * {@code <accession>_<PE|SE>_<crop>_crop_<n>rep_<pipeline>_<alignonly|peakcall>}, with
     * {@code no_crop} in place of the crop part when {@code cropLength} is {@code null}.
     */
    static String describe(String accession, boolean paired, Integer cropLength, int replicates,
                           PipelineType pipelineType, boolean alignOnly) {
        return String.format("%s_%s_%s_%drep_%s_%s",
                accession,
                paired ? "PE" : "SE",
                cropLength == null ? "no_crop" : cropLength + "_crop",
                replicates,
                pipelineType.label(),
                alignOnly ? "alignonly" : "peakcall");
    }
}
