package org.chipinput.metrics;

import org.chipinput.model.ChipInputConfig;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Helper methods for creating results, especially for failure cases, and merging them into one run report.
 */
public final class StatusHelper {

    private static final Logger LOGGER = Logger.getLogger(StatusHelper.class.getName());

    private StatusHelper() {
    } // Prevent instantiation

    // --- Result creators ---

    public static ExperimentResult createPassResult(ChipInputConfig config, Instant start) {
        return new ExperimentResult(config.title(), Status.PASS, config, null,
                Duration.between(start, Instant.now()), Thread.currentThread().getName());
    }

    public static ExperimentResult createFailedResult(ErrorRecord error, Instant start) {
        return new ExperimentResult(error.accession(), Status.FAIL, null, error,
                Duration.between(start, Instant.now()), Thread.currentThread().getName());
    }

    /**
     * Failure result for an experiment whose worker threw instead of returning a result.
     */
    public static ExperimentResult createCrashedResult(String accession, ErrorTag tag, Throwable cause) {
        String message = "Unexpected " + cause.getClass().getSimpleName() + ": " + cause.getMessage();
        return new ExperimentResult(accession, Status.FAIL, null, ErrorRecord.of(accession, tag, message),
                Duration.ZERO, Thread.currentThread().getName());
    }

    // --- Merging ---

    /**
     * Merges per-experiment results into one report sorted by accession. Repeated results for the
     * same accession are merged; once an accession failed it stays in the error map only.
     */
    public static ExecutionInfo mergeResults(Collection<ExperimentResult> results, Instant executionStart) {
        final SortedMap<String, ChipInputConfig> configs = new TreeMap<>();
        final SortedMap<String, ErrorRecord> errors = new TreeMap<>();

        for (ExperimentResult result : results) {
            if (result.status() == Status.FAIL) {
                errors.merge(result.accession(), result.error(), ErrorRecord::merge);
                configs.remove(result.accession());
            } else if (!errors.containsKey(result.accession())) {
                configs.put(result.accession(), result.config());
            }
        }
        return new ExecutionInfo(Duration.between(executionStart, Instant.now()), configs, errors);
    }

    // --- Status Determination ---

    /**
     * Determines the overall status of a run: FAIL when any result failed or some expected
     * results are missing.
     */
    public static <T extends HasStatus> Status determineOverallStatus(final List<T> results, final int expectedTaskCount,
                                                                       final String levelName) {
        final long failed = results.stream().filter(r -> r.status() == Status.FAIL).count();
        if (failed > 0) {
            LOGGER.warning(String.format("%s: %d of %d experiments excluded.", levelName, failed, expectedTaskCount));
            return Status.FAIL;
        }
        if (results.size() < expectedTaskCount) {
            LOGGER.warning(String.format("%s: only %d of %d experiments produced a result.",
                    levelName, results.size(), expectedTaskCount));
            return Status.FAIL;
        }
        LOGGER.info(String.format("%s: all %d experiments configured.", levelName, expectedTaskCount));
        return Status.PASS;
    }
}
