package org.chipinput.model;

import java.util.List;

/**
 * One replicate of an experiment.
 *
 * @param antibodyTargets target ids of the replicate's antibody, {@code null} when the replicate
 *                        carries no antibody metadata at all
 * @param organism        scientific name of the biosample organism
 */
public record ReplicateRecord(List<String> antibodyTargets, String organism) {
    public ReplicateRecord {
        if (antibodyTargets != null) antibodyTargets = List.copyOf(antibodyTargets);
    }

    public boolean hasAntibody() {
        return antibodyTargets != null;
    }
}
