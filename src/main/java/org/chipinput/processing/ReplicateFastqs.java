package org.chipinput.processing;

import org.chipinput.model.FileRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.chipinput.model.ChipInputKeys.MAX_REPLICATES;

/**
 * Fastq URIs of an experiment grouped into replicate slots, plus the usable fastq files they came from.
 * Slot lists are indexed from 0 (replicate slot 1) and always hold {@link org.chipinput.model.ChipInputKeys#MAX_REPLICATES} entries.
 */
public record ReplicateFastqs(List<List<String>> r1, List<List<String>> r2, List<FileRecord> usableFastqs) {

    public ReplicateFastqs {
        if (r1.size() != MAX_REPLICATES || r2.size() != MAX_REPLICATES) {
            throw new IllegalArgumentException("Expected " + MAX_REPLICATES + " replicate slots");
        }
        r1 = freeze(r1);
        r2 = freeze(r2);
        usableFastqs = List.copyOf(usableFastqs);
    }

    private static List<List<String>> freeze(List<List<String>> slots) {
        List<List<String>> copy = new ArrayList<>(slots.size());
        for (List<String> slot : slots) copy.add(List.copyOf(slot));
        return Collections.unmodifiableList(copy);
    }

    static List<List<String>> emptySlots() {
        List<List<String>> slots = new ArrayList<>(MAX_REPLICATES);
        for (int i = 0; i < MAX_REPLICATES; i++) slots.add(new ArrayList<>());
        return slots;
    }

    public boolean isEmpty() {
        return r1.stream().allMatch(List::isEmpty);
    }

    public int replicateCount() {
        return (int) r1.stream().filter(l -> !l.isEmpty()).count();
    }

    /**
     * Moves populated slots to the front without changing their relative order. R2 lists travel
     * with their R1 lists.
     */
    public ReplicateFastqs compact() {
        List<List<String>> newR1 = new ArrayList<>(MAX_REPLICATES);
        List<List<String>> newR2 = new ArrayList<>(MAX_REPLICATES);
        for (int i = 0; i < MAX_REPLICATES; i++) {
            if (!r1.get(i).isEmpty()) {
                newR1.add(r1.get(i));
                newR2.add(r2.get(i));
            }
        }
        while (newR1.size() < MAX_REPLICATES) {
            newR1.add(List.of());
            newR2.add(List.of());
        }
        return new ReplicateFastqs(newR1, newR2, usableFastqs);
    }
}
