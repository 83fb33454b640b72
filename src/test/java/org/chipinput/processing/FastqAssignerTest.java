package org.chipinput.processing;

import org.chipinput.metrics.ErrorTag;
import org.chipinput.model.ExperimentRecord;
import org.chipinput.model.FileRecord;
import org.chipinput.model.MetadataSet;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.chipinput.processing.MetadataFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class FastqAssignerTest {

    private static final String EXP = "ENCSR000AAA";

    @Test
    void testAssign_pairsMatesAndCompactsSlots() {
        List<FileRecord> files = List.of(
                mate1("ENCFF001AAA", "ENCFF002AAA", EXP, 1, 100),
                mate2("ENCFF002AAA", "ENCFF001AAA", EXP, 1, 100),
                mate1("ENCFF003AAA", "ENCFF004AAA", EXP, 3, 100),
                mate2("ENCFF004AAA", "ENCFF003AAA", EXP, 3, 100));
        ExperimentRecord experiment = experiment(EXP, "TF ChIP-seq", files, List.of());
        MetadataSet metadata = metadata(List.of(experiment), files);

        Resolution<ReplicateFastqs> result = new FastqAssigner(metadata).assign(experiment, false);

        assertTrue(result.isSuccess(), "Assignment should succeed: " + result);
        ReplicateFastqs fastqs = result.value();
        assertEquals(List.of(uri("ENCFF001AAA")), fastqs.r1().get(0));
        assertEquals(List.of(uri("ENCFF002AAA")), fastqs.r2().get(0));
        assertEquals(List.of(uri("ENCFF003AAA")), fastqs.r1().get(1), "Replicate 3 should move up to slot 2.");
        assertEquals(List.of(uri("ENCFF004AAA")), fastqs.r2().get(1));
        assertEquals(2, fastqs.replicateCount());
        assertEquals(4, fastqs.usableFastqs().size());
        for (int i = 2; i < 10; i++) {
            assertTrue(fastqs.r1().get(i).isEmpty(), "Slot " + (i + 1) + " should be empty.");
        }
    }

    @Test
    void testAssign_compactionKeepsReplicateOrderWithoutGaps() {
        List<FileRecord> files = new ArrayList<>();
        files.add(singleFastq("ENCFF010AAA", EXP, 9, 50));
        files.add(singleFastq("ENCFF011AAA", EXP, 2, 50));
        files.add(singleFastq("ENCFF012AAA", EXP, 5, 50));
        files.add(singleFastq("ENCFF013AAA", EXP, 2, 50));
        ExperimentRecord experiment = experiment(EXP, "Histone ChIP-seq", files, List.of());

        ReplicateFastqs fastqs = new FastqAssigner(metadata(List.of(experiment), files)).assign(experiment, false).value();

        assertEquals(List.of(uri("ENCFF011AAA"), uri("ENCFF013AAA")), fastqs.r1().get(0));
        assertEquals(List.of(uri("ENCFF012AAA")), fastqs.r1().get(1));
        assertEquals(List.of(uri("ENCFF010AAA")), fastqs.r1().get(2));
        boolean seenEmpty = false;
        for (List<String> slot : fastqs.r1()) {
            if (slot.isEmpty()) {
                seenEmpty = true;
            } else {
                assertFalse(seenEmpty, "A populated slot must never follow an empty one.");
            }
        }
    }

    @Test
    void testAssign_forceSingleEndSkipsMates() {
        List<FileRecord> files = List.of(
                mate1("ENCFF001AAA", "ENCFF002AAA", EXP, 1, 100),
                mate2("ENCFF002AAA", "ENCFF001AAA", EXP, 1, 100));
        ExperimentRecord experiment = experiment(EXP, "TF ChIP-seq", files, List.of());

        ReplicateFastqs fastqs = new FastqAssigner(metadata(List.of(experiment), files)).assign(experiment, true).value();

        assertEquals(List.of(uri("ENCFF001AAA")), fastqs.r1().get(0));
        assertTrue(fastqs.r2().stream().allMatch(List::isEmpty), "No read 2 files when forced single-ended.");
    }

    @Test
    void testAssign_missingMateFails() {
        List<FileRecord> files = List.of(
                mate1("ENCFF001AAA", "ENCFF002AAA", EXP, 1, 100),
                mate1("ENCFF005AAA", "ENCFF999AAA", EXP, 2, 100),
                mate2("ENCFF002AAA", "ENCFF001AAA", EXP, 1, 100));
        ExperimentRecord experiment = experiment(EXP, "TF ChIP-seq", files, List.of());

        Resolution<ReplicateFastqs> result = new FastqAssigner(metadata(List.of(experiment), files)).assign(experiment, false);

        assertFalse(result.isSuccess());
        assertEquals(List.of(ErrorTag.MissingMatePair), result.tags());
        assertTrue(result.error().messages().get(0).contains(uri("ENCFF005AAA")));
    }

    @Test
    void testAssign_revokedMateIsMissing() {
        List<FileRecord> files = List.of(
                mate1("ENCFF001AAA", "ENCFF002AAA", EXP, 1, 100),
                withStatus(mate2("ENCFF002AAA", "ENCFF001AAA", EXP, 1, 100), "revoked", RELEASED));
        ExperimentRecord experiment = experiment(EXP, "TF ChIP-seq", files, List.of());

        Resolution<ReplicateFastqs> result = new FastqAssigner(metadata(List.of(experiment), files)).assign(experiment, false);

        assertFalse(result.isSuccess(), "A revoked read 2 must not be paired.");
        assertEquals(List.of(ErrorTag.MissingMatePair), result.tags());
        assertTrue(result.error().messages().get(0).contains(uri("ENCFF001AAA")));
    }

    @Test
    void testAssign_unusableStatusesGiveNoUsableFastqs() {
        List<FileRecord> files = List.of(
                withStatus(singleFastq("ENCFF001AAA", EXP, 1, 50), "revoked", RELEASED),
                withStatus(singleFastq("ENCFF002AAA", EXP, 2, 50), RELEASED, "deleted"));
        ExperimentRecord experiment = experiment(EXP, "TF ChIP-seq", files, List.of());

        Resolution<ReplicateFastqs> result = new FastqAssigner(metadata(List.of(experiment), files)).assign(experiment, false);

        assertEquals(List.of(ErrorTag.NoUsableFastqs), result.tags());
    }

    @Test
    void testAssign_inProgressFilesAreUsable() {
        List<FileRecord> files = List.of(withStatus(singleFastq("ENCFF001AAA", EXP, 1, 50), "in progress", "in progress"));
        ExperimentRecord experiment = experiment(EXP, "TF ChIP-seq", files, List.of());

        Resolution<ReplicateFastqs> result = new FastqAssigner(metadata(List.of(experiment), files)).assign(experiment, false);

        assertTrue(result.isSuccess());
        assertEquals(1, result.value().replicateCount());
    }

    @Test
    void testAssign_replicateOutsideSlotsIsIgnored() {
        List<FileRecord> files = List.of(
                singleFastq("ENCFF001AAA", EXP, 1, 50),
                singleFastq("ENCFF002AAA", EXP, 11, 36));
        ExperimentRecord experiment = experiment(EXP, "TF ChIP-seq", files, List.of());

        ReplicateFastqs fastqs = new FastqAssigner(metadata(List.of(experiment), files)).assign(experiment, false).value();

        assertEquals(1, fastqs.replicateCount());
        assertFalse(fastqs.r1().stream().anyMatch(slot -> slot.contains(uri("ENCFF002AAA"))));
    }
}
