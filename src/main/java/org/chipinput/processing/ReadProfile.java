package org.chipinput.processing;

import org.chipinput.model.RunType;

/**
 * Endedness and minimum read length of an experiment's usable fastqs.
 *
 * @param minReadLength the override crop length when one was requested, otherwise the shortest read length
 * @param cropOverridden whether {@code minReadLength} came from the request instead of the files
 */
public record ReadProfile(RunType runType, int minReadLength, boolean cropOverridden) {
}
