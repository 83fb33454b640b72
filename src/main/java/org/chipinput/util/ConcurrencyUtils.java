package org.chipinput.util;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Utility methods for handling concurrency, executors, and futures.
 */
public final class ConcurrencyUtils {

    private static final Logger LOGGER = Logger.getLogger(ConcurrencyUtils.class.getName());
    private static final Duration SHUTDOWN_WAIT_TIMEOUT = Duration.ofSeconds(60);

    private ConcurrencyUtils() {
    } // Prevent instantiation

    /**
     * Creates a ThreadFactory for named platform threads ({@code prefix} followed by a counter).
     */
    public static ThreadFactory createPlatformThreadFactory(final String prefix) {
        final AtomicInteger counter = new AtomicInteger(1);
        return runnable -> {
            final Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(false);
            return thread;
        };
    }

    /**
     * Gracefully shuts down an ExecutorService.
     */
    public static void shutdownExecutorService(final ExecutorService executor, final String name) {
        if (executor == null) return;
        LOGGER.fine(() -> "Attempting graceful shutdown of executor: " + name);

        executor.shutdown(); // Disable new tasks
        try {
            if (!executor.awaitTermination(SHUTDOWN_WAIT_TIMEOUT.toSeconds(), TimeUnit.SECONDS)) {
                LOGGER.warning(String.format("Executor %s did not terminate in %ds, attempting forceful shutdown...",
                        name, SHUTDOWN_WAIT_TIMEOUT.toSeconds()));
                final List<Runnable> droppedTasks = executor.shutdownNow();
                LOGGER.warning(String.format("Executor %s forcing shutdown. Dropped %d waiting tasks.", name, droppedTasks.size()));

                if (!executor.awaitTermination(SHUTDOWN_WAIT_TIMEOUT.toSeconds(), TimeUnit.SECONDS))
                    LOGGER.severe("Executor " + name + " did not terminate even after forcing.");
                else
                    LOGGER.info("Executor " + name + " terminated after forcing.");

            } else
                LOGGER.fine(() -> "Executor " + name + " terminated gracefully.");

        } catch (final InterruptedException ie) {
            LOGGER.warning("Shutdown wait for executor " + name + " interrupted. Forcing shutdown now.");
            executor.shutdownNow();
            Thread.currentThread().interrupt(); // Preserve interrupt status
        }
    }

    /**
     * Waits for a list of CompletableFutures to complete, collects their results, and logs errors.
     * Futures that completed exceptionally or were cancelled are left out of the returned list.
     */
    public static <T> List<T> waitForCompletableFuturesAndCollect(
            final String levelName,
            final List<CompletableFuture<T>> futures,
            final Object identifier) {

        final String idStr = identifier != null ? identifier.toString() : "N/A";
        if (futures.isEmpty()) {
            LOGGER.info(String.format("No %s job to wait for (ID: %s).", levelName, idStr));
            return Collections.emptyList();
        }

        final List<T> results = new ArrayList<>();
        LOGGER.fine(() -> String.format("Waiting for %d %s jobs (ID: %s)...", futures.size(), levelName, idStr));

        final CompletableFuture<Void> allOf = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));

        try {
            allOf.join();
        } catch (final CancellationException e) {
            LOGGER.severe(String.format("%s waiting (allOf) was cancelled (ID: %s).", levelName, idStr));
        } catch (final CompletionException e) {
            LOGGER.log(Level.SEVERE, String.format("Unexpected error during completion of %s jobs (ID: %s)", levelName, idStr), e);
        }

        for (final CompletableFuture<T> future : futures) {
            try {
                results.add(future.join());
            } catch (final CompletionException e) {
                LOGGER.severe(String.format("%s job (ID: %s) completed exceptionally: %s", levelName, idStr,
                        e.getCause() != null ? e.getCause().getMessage() : e.getMessage()));
            } catch (final CancellationException e) {
                LOGGER.severe(String.format("%s job (ID: %s) was cancelled.", levelName, idStr));
            }
        }

        LOGGER.info(String.format("Finished waiting for %s (ID: %s). Collected %d results (out of %d submitted).",
                levelName, idStr, results.size(), futures.size()));
        return results; // Return potentially partial results
    }
}
