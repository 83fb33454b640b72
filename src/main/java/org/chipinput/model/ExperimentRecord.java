package org.chipinput.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Catalog view of one experiment. {@code fileUris} and {@code possibleControls} keep catalog order.
 */
public record ExperimentRecord(String id, String accession, String assayTitle, String controlType,
                               List<ReplicateRecord> replicates, List<String> fileUris,
                               List<String> possibleControls) {
    public ExperimentRecord {
        Objects.requireNonNull(accession, "accession");
        replicates = replicates == null ? Collections.emptyList() : List.copyOf(replicates);
        fileUris = fileUris == null ? Collections.emptyList() : List.copyOf(fileUris);
        possibleControls = possibleControls == null ? Collections.emptyList() : List.copyOf(possibleControls);
    }

    public boolean isControlTypeSet() {
        return controlType != null && !controlType.isBlank();
    }

    public Set<String> organisms() {
        Set<String> organisms = new LinkedHashSet<>();
        for (ReplicateRecord rep : replicates) {
            if (rep.organism() != null) organisms.add(rep.organism());
        }
        return organisms;
    }
}
