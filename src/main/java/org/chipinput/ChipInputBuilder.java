package org.chipinput;

import org.chipinput.config.AppConfig;
import org.chipinput.config.ConfigManager;
import org.chipinput.config.ExperimentRequest;
import org.chipinput.config.RequestTableParser;
import org.chipinput.datasources.PortalReportLoader;
import org.chipinput.metrics.ErrorRecord;
import org.chipinput.metrics.ErrorTag;
import org.chipinput.metrics.ExecutionInfo;
import org.chipinput.metrics.ExperimentResult;
import org.chipinput.metrics.StatusHelper;
import org.chipinput.model.ChipInputConfig;
import org.chipinput.model.MetadataSet;
import org.chipinput.plugin.MetadataSource;
import org.chipinput.processing.CaperCommandBuilder;
import org.chipinput.processing.ChipInputWriter;
import org.chipinput.processing.ErrorReportWriter;
import org.chipinput.processing.ExperimentProcessor;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import static org.chipinput.util.ConcurrencyUtils.*;

/**
 * Builds ChIP-seq pipeline inputs for a table of requested experiments.
 * <p>
 * Every experiment is resolved on its own worker against the same read-only metadata. Experiments
 * that cannot be configured end up in the error report; they never stop the rest of the run.
 */
public class ChipInputBuilder {

    private static final Logger LOGGER = Logger.getLogger(ChipInputBuilder.class.getName());

    private final MetadataSet metadata;
    private final List<ExperimentRequest> requests;
    private final int numThreads;

    public ChipInputBuilder(final MetadataSet metadata, final List<ExperimentRequest> requests, final int numThreads) {
        this.metadata = Objects.requireNonNull(metadata, "Metadata cannot be null");
        this.requests = List.copyOf(Objects.requireNonNull(requests, "Requests cannot be null"));
        this.numThreads = Math.max(1, numThreads);
        if (this.requests.isEmpty()) {
            LOGGER.warning("No experiments requested.");
        }
    }

    List<ExperimentRequest> getRequests() {
        return requests;
    }

    public ExecutionInfo execute() {
        final Instant executionStart = Instant.now();
        final int concurrency = Math.min(numThreads, Math.max(1, requests.size()));
        final ThreadFactory factory = createPlatformThreadFactory("Experiment-");
        final ExecutorService executor = Executors.newFixedThreadPool(concurrency, factory);
        final List<CompletableFuture<ExperimentResult>> futures = new ArrayList<>();
        final List<ExperimentResult> results;

        LOGGER.info(String.format("Resolving %d experiments on %d threads.", requests.size(), concurrency));
        try {
            for (final ExperimentRequest request : requests) {
                futures.add(CompletableFuture.supplyAsync(
                        () -> {
                            try {
                                return new ExperimentProcessor(metadata, request).processExperiment();
                            } catch (final RuntimeException e) {
                                LOGGER.log(Level.SEVERE, "Uncaught exception resolving experiment " + request.accession(), e);
                                return StatusHelper.createCrashedResult(request.accession(), ErrorTag.ProcessingFailure, e);
                            }
                        },
                        executor));
            }
            results = waitForCompletableFuturesAndCollect("Experiment", futures, null);
        } finally {
            shutdownExecutorService(executor, "ExperimentExecutor");
        }

        StatusHelper.determineOverallStatus(results, requests.size(), "Run");
        return StatusHelper.mergeResults(results, executionStart);
    }

    /**
     * Writes the pipeline inputs, the caper submission script and the error report.
     */
    public static void writeOutputs(final ExecutionInfo info, final AppConfig config) throws IOException {
        final Path outputDir = config.output().outputDir();
        new ChipInputWriter(outputDir).writeAll(info.configs().values());
        new CaperCommandBuilder(config.output()).write(info.configs().values());
        final Path errorReport = new ErrorReportWriter(outputDir).write(info.errors().values());
        if (!info.errors().isEmpty()) {
            LOGGER.warning(String.format("%d experiments excluded, see %s", info.errors().size(), errorReport.toAbsolutePath()));
        }
    }

    static void printSummary(final ExecutionInfo info) {
        System.out.println("\n--- Execution Summary ---");
        System.out.printf("Experiments: %d, configured: %d, excluded: %d, total time: %d ms%n",
                info.experimentCount(), info.configs().size(), info.errors().size(), info.totalDuration().toMillis());
        for (Map.Entry<String, ChipInputConfig> e : info.configs().entrySet()) {
            System.out.printf("  %-12s %s%n", e.getKey(), e.getValue().description());
        }
        for (Map.Entry<String, ErrorRecord> e : info.errors().entrySet()) {
            System.out.printf("  %-12s %s%n", e.getKey(),
                    e.getValue().tags().stream().map(ErrorTag::name).collect(Collectors.joining(", ")));
        }
    }

    public static void main(final String[] args) {
        final Path configPath = args.length > 0 ? Path.of(args[0]) : ConfigManager.DEFAULT_CONFIG_PATH;
        try {
            final AppConfig config = ConfigManager.getConfig(configPath);
            final List<ExperimentRequest> requests = new RequestTableParser().parse(config.requests().requestFile());
            final MetadataSource source = new PortalReportLoader(config.metadata());
            final MetadataSet metadata = source.load(requests.stream().map(ExperimentRequest::accession).collect(Collectors.toList()));

            final ChipInputBuilder builder = new ChipInputBuilder(metadata, requests, config.engine().numThreads());
            final ExecutionInfo info = builder.execute();
            writeOutputs(info, config);
            printSummary(info);
        } catch (final IOException | IllegalArgumentException e) {
            LOGGER.log(Level.SEVERE, "Failed to build pipeline inputs: " + e.getMessage(), e);
            System.exit(1);
        }
    }
}
