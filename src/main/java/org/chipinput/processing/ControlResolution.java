package org.chipinput.processing;

import org.chipinput.model.RunType;

import java.util.List;

/**
 * Controls chosen for an experiment and the endedness and read length shared by the experiment and
 * those controls.
 *
 * @param controls              chosen control dataset ids; empty when the experiment is itself a control
 * @param combinedMinReadLength shortest read length over experiment and controls, used to search control bams
 * @param cropLength            crop length written to the pipeline input; differs from
 *                              {@code combinedMinReadLength} only when the request overrides it
 */
public record ControlResolution(List<String> controls, RunType combinedRunType, int combinedMinReadLength,
                                int cropLength) {
    public ControlResolution {
        controls = List.copyOf(controls);
    }

    public boolean needsControlBams() {
        return !controls.isEmpty();
    }
}
