package org.chipinput.processing;

import org.chipinput.config.ExperimentRequest;
import org.chipinput.metrics.ErrorTag;
import org.chipinput.model.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.chipinput.processing.MetadataFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ControlResolverTest {

    private static final String EXP = "ENCSR000AAA";
    private static final String CTL1 = "ENCSR100CTL";
    private static final String CTL2 = "ENCSR200CTL";

    private static final ReadProfile PAIRED_100 = new ReadProfile(RunType.PAIRED_ENDED, 100, false);

    private static List<FileRecord> pairedControlFastqs(String control, int readLength) {
        return List.of(
                mate1("ENCFF" + control.substring(5, 8) + "R1", "ENCFF" + control.substring(5, 8) + "R2", control, 1, readLength),
                mate2("ENCFF" + control.substring(5, 8) + "R2", "ENCFF" + control.substring(5, 8) + "R1", control, 1, readLength));
    }

    private static ExperimentRecord tfExperiment(List<String> controls, ReplicateRecord... replicates) {
        return new ExperimentRecord(dataset(EXP), EXP, "TF ChIP-seq", null,
                replicates.length == 0 ? List.of(replicate(CTCF)) : List.of(replicates), List.of(), controls);
    }

    @Test
    void testResolve_controlExperimentNeedsNoControls() {
        ControlResolver resolver = new ControlResolver(metadata(List.of(), List.of()));
        ExperimentRecord control = control(EXP, "Control ChIP-seq", List.of());

        ControlResolution resolution = resolver.resolve(control, PipelineType.CONTROL, PAIRED_100, request(EXP)).value();

        assertTrue(resolution.controls().isEmpty());
        assertFalse(resolution.needsControlBams());
        assertEquals(RunType.PAIRED_ENDED, resolution.combinedRunType());
        assertEquals(100, resolution.cropLength());
    }

    @Test
    void testResolve_noPossibleControls() {
        ControlResolver resolver = new ControlResolver(metadata(List.of(), List.of()));

        Resolution<ControlResolution> result = resolver.resolve(tfExperiment(List.of()), PipelineType.TF, PAIRED_100, request(EXP));

        assertEquals(List.of(ErrorTag.MissingControls), result.tags());
    }

    @Test
    void testResolve_tooManyControls() {
        List<FileRecord> files = new ArrayList<>(pairedControlFastqs(CTL1, 100));
        files.addAll(pairedControlFastqs(CTL2, 100));
        ControlResolver resolver = new ControlResolver(metadata(List.of(), files));

        Resolution<ControlResolution> result = resolver.resolve(
                tfExperiment(List.of(dataset(CTL1), dataset(CTL2))), PipelineType.TF, PAIRED_100, request(EXP));

        assertEquals(List.of(ErrorTag.TooManyControls), result.tags());
    }

    @Test
    void testResolve_replicateWithoutAntibody() {
        ControlResolver resolver = new ControlResolver(metadata(List.of(), List.of()));
        ExperimentRecord experiment = tfExperiment(List.of(dataset(CTL1), dataset(CTL2)),
                replicate(ControlResolver.EGFP_TARGET), new ReplicateRecord(null, HUMAN));

        Resolution<ControlResolution> result = resolver.resolve(experiment, PipelineType.TF, PAIRED_100, request(EXP));

        assertEquals(List.of(ErrorTag.MissingAntibodyMetadata), result.tags());
    }

    @Test
    void testResolve_egfpExperimentUsesWildtypeControl() {
        List<FileRecord> files = new ArrayList<>(pairedControlFastqs(CTL1, 100));
        files.addAll(pairedControlFastqs(CTL2, 100));
        ControlResolver resolver = new ControlResolver(metadata(List.of(), files, dataset(CTL2)));
        ExperimentRecord experiment = tfExperiment(List.of(dataset(CTL1), dataset(CTL2)),
                replicate(ControlResolver.EGFP_TARGET), replicate(ControlResolver.EGFP_TARGET));

        Resolution<ControlResolution> result = resolver.resolve(experiment, PipelineType.TF, PAIRED_100, request(EXP));

        assertTrue(result.isSuccess(), "eGFP experiment should narrow to its wildtype control: " + result);
        assertEquals(List.of(dataset(CTL2)), result.value().controls());
    }

    @Test
    void testResolve_egfpWithoutWildtypeControl() {
        ControlResolver resolver = new ControlResolver(metadata(List.of(), List.of()));
        ExperimentRecord experiment = tfExperiment(List.of(dataset(CTL1), dataset(CTL2)), replicate(ControlResolver.EGFP_TARGET));

        Resolution<ControlResolution> result = resolver.resolve(experiment, PipelineType.TF, PAIRED_100, request(EXP));

        assertEquals(List.of(ErrorTag.NoWildtypeControlFound), result.tags());
    }

    @Test
    void testResolve_egfpHistoneIsNotNarrowed() {
        ControlResolver resolver = new ControlResolver(metadata(List.of(), List.of(), dataset(CTL2)));
        ExperimentRecord experiment = tfExperiment(List.of(dataset(CTL1), dataset(CTL2)), replicate(ControlResolver.EGFP_TARGET));

        Resolution<ControlResolution> result = resolver.resolve(experiment, PipelineType.HISTONE, PAIRED_100, request(EXP));

        assertEquals(List.of(ErrorTag.TooManyControls), result.tags());
    }

    @Test
    void testResolve_multipleControlsRequested() {
        List<FileRecord> files = new ArrayList<>(pairedControlFastqs(CTL1, 100));
        files.addAll(pairedControlFastqs(CTL2, 76));
        ControlResolver resolver = new ControlResolver(metadata(List.of(), files));
        ExperimentRequest multiple = new ExperimentRequest(EXP, false, "", null, true, false, false);

        ControlResolution resolution = resolver.resolve(
                tfExperiment(List.of(dataset(CTL1), dataset(CTL2))), PipelineType.TF, PAIRED_100, multiple).value();

        assertEquals(List.of(dataset(CTL1), dataset(CTL2)), resolution.controls());
        assertEquals(RunType.PAIRED_ENDED, resolution.combinedRunType());
        assertEquals(76, resolution.combinedMinReadLength());
        assertEquals(76, resolution.cropLength());
    }

    @Test
    void testResolve_singleEndedControlMakesCombinedSingleEnded() {
        List<FileRecord> files = List.of(singleFastq("ENCFF100SE1", CTL1, 1, 50));
        ControlResolver resolver = new ControlResolver(metadata(List.of(), files));

        ControlResolution resolution = resolver.resolve(
                tfExperiment(List.of(dataset(CTL1))), PipelineType.TF, PAIRED_100, request(EXP)).value();

        assertEquals(RunType.SINGLE_ENDED, resolution.combinedRunType());
        assertEquals(50, resolution.combinedMinReadLength());
    }

    @Test
    void testResolve_singleEndedExperimentWithPairedControl() {
        ControlResolver resolver = new ControlResolver(metadata(List.of(), pairedControlFastqs(CTL1, 100)));
        ReadProfile single = new ReadProfile(RunType.SINGLE_ENDED, 36, false);

        ControlResolution resolution = resolver.resolve(tfExperiment(List.of(dataset(CTL1))), PipelineType.TF, single, request(EXP)).value();

        assertEquals(RunType.SINGLE_ENDED, resolution.combinedRunType());
        assertEquals(36, resolution.cropLength());
    }

    @Test
    void testResolve_controlWithoutFastqsIsIndeterminate() {
        ControlResolver resolver = new ControlResolver(metadata(List.of(), List.of()));

        Resolution<ControlResolution> result = resolver.resolve(
                tfExperiment(List.of(dataset(CTL1))), PipelineType.TF, PAIRED_100, request(EXP));

        assertEquals(List.of(ErrorTag.IndeterminateEndedness), result.tags());
    }

    @Test
    void testResolve_overrideCropLengthKeptWhileCombinedUsesControls() {
        ControlResolver resolver = new ControlResolver(metadata(List.of(), pairedControlFastqs(CTL1, 50)));
        ReadProfile overridden = new ReadProfile(RunType.PAIRED_ENDED, 100, true);
        ExperimentRequest override = new ExperimentRequest(EXP, false, "", 100, false, false, false);

        ControlResolution resolution = resolver.resolve(tfExperiment(List.of(dataset(CTL1))), PipelineType.TF, overridden, override).value();

        assertEquals(100, resolution.cropLength(), "Assigned crop length follows the override.");
        assertEquals(50, resolution.combinedMinReadLength(), "Bam search uses the combined minimum.");
    }
}
