package org.chipinput;

import org.chipinput.config.AppConfig;
import org.chipinput.config.EngineItem;
import org.chipinput.config.ExperimentRequest;
import org.chipinput.config.MetadataSourceItem;
import org.chipinput.config.OutputItem;
import org.chipinput.config.RequestsItem;
import org.chipinput.datasources.PortalReportLoader;
import org.chipinput.metrics.ErrorRecord;
import org.chipinput.metrics.ErrorTag;
import org.chipinput.metrics.ExecutionInfo;
import org.chipinput.metrics.ExperimentResult;
import org.chipinput.metrics.StatusHelper;
import org.chipinput.model.ChipInputConfig;
import org.chipinput.model.MetadataSet;
import org.chipinput.util.ConcurrencyUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.MockedStatic;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ChipInputBuilderTest {

    @Mock
    private MetadataSet mockMetadata;

    @TempDir
    Path tempDir;

    private static ExperimentResult failed(String accession, ErrorTag tag) {
        return StatusHelper.createFailedResult(ErrorRecord.of(accession, tag, "simulated"), Instant.now());
    }

    @Test
    void testExecute_submitsOneTaskPerRequestAndMergesByAccession() {
        List<ExperimentRequest> requests = List.of(
                ExperimentRequest.of("ENCSR300CCC", false),
                ExperimentRequest.of("ENCSR100AAA", false));
        ChipInputBuilder builder = new ChipInputBuilder(mockMetadata, requests, 8);

        try (MockedStatic<ConcurrencyUtils> mockedConcurrencyUtils = mockStatic(ConcurrencyUtils.class);
             MockedStatic<Executors> mockedExecutors = mockStatic(Executors.class)) {

            ExecutorService mockExecutorService = mock(ExecutorService.class);
            ThreadFactory mockThreadFactory = mock(ThreadFactory.class);

            mockedExecutors.when(() -> Executors.newFixedThreadPool(anyInt(), any(ThreadFactory.class)))
                    .thenReturn(mockExecutorService);
            mockedConcurrencyUtils.when(() -> ConcurrencyUtils.createPlatformThreadFactory(anyString()))
                    .thenReturn(mockThreadFactory);
            mockedConcurrencyUtils.when(() -> ConcurrencyUtils.waitForCompletableFuturesAndCollect(
                            eq("Experiment"), anyList(), isNull()))
                    .thenAnswer(invocation -> {
                        List<?> futuresPassed = invocation.getArgument(1);
                        assertEquals(2, futuresPassed.size(), "One future per requested experiment.");
                        return List.of(failed("ENCSR300CCC", ErrorTag.TooManyControls),
                                failed("ENCSR100AAA", ErrorTag.MissingControls));
                    });

            ExecutionInfo info = builder.execute();

            assertEquals(List.of("ENCSR100AAA", "ENCSR300CCC"), List.copyOf(info.errors().keySet()));
            assertTrue(info.configs().isEmpty());

            // Pool never exceeds the number of requests.
            mockedExecutors.verify(() -> Executors.newFixedThreadPool(eq(2), eq(mockThreadFactory)));
            mockedConcurrencyUtils.verify(() -> ConcurrencyUtils.shutdownExecutorService(eq(mockExecutorService), eq("ExperimentExecutor")));
        }
    }

    @Test
    void testExecute_noRequests() {
        ChipInputBuilder builder = new ChipInputBuilder(mockMetadata, Collections.emptyList(), 4);

        ExecutionInfo info = builder.execute();

        assertEquals(0, info.experimentCount());
        assertTrue(builder.getRequests().isEmpty());
    }

    @Test
    void testExecute_endToEndFromReports() throws Exception {
        Path reportDir = Path.of(Objects.requireNonNull(getClass().getResource("/metadata")).toURI());
        AppConfig config = new AppConfig(
                new MetadataSourceItem(reportDir, null, null, null, null, null, null),
                new RequestsItem(null),
                new OutputItem(tempDir, "chip.wdl", "gs://bucket/inputs/", null),
                new EngineItem(3));
        List<ExperimentRequest> requests = List.of(
                ExperimentRequest.of("ENCSR001EXP", false),
                ExperimentRequest.of("ENCSR002EXP", false),
                ExperimentRequest.of("ENCSR100CTL", true),
                ExperimentRequest.of("ENCSR404NOP", false));
        MetadataSet metadata = new PortalReportLoader(config.metadata())
                .load(requests.stream().map(ExperimentRequest::accession).collect(Collectors.toList()));

        ExecutionInfo info = new ChipInputBuilder(metadata, requests, config.engine().numThreads()).execute();
        ChipInputBuilder.writeOutputs(info, config);

        assertEquals(List.of("ENCSR001EXP", "ENCSR100CTL"), List.copyOf(info.configs().keySet()));
        ChipInputConfig egfp = info.configs().get("ENCSR001EXP");
        assertEquals("ENCSR001EXP_PE_100_crop_1rep_tf_peakcall", egfp.description());
        assertEquals(List.of("https://www.encodeproject.org/files/ENCFF900BAM/@@download/ENCFF900BAM.bam"), egfp.ctlNodupBams());
        assertEquals("ENCSR100CTL_PE_101_crop_1rep_control_alignonly", info.configs().get("ENCSR100CTL").description());

        assertEquals(List.of(ErrorTag.MissingControls), info.errors().get("ENCSR002EXP").tags());
        assertEquals(List.of(ErrorTag.ExperimentNotFound), info.errors().get("ENCSR404NOP").tags());

        assertTrue(Files.exists(tempDir.resolve("ENCSR001EXP_PE_100_crop_1rep_tf_peakcall.json")));
        assertTrue(Files.exists(tempDir.resolve("ENCSR100CTL_PE_101_crop_1rep_control_alignonly.json")));
        List<String> script = Files.readAllLines(tempDir.resolve("caper_submit.sh"));
        assertEquals("caper submit chip.wdl -i gs://bucket/inputs/ENCSR001EXP_PE_100_crop_1rep_tf_peakcall.json"
                + " -s ENCSR001EXP_PE_100_crop_1rep_tf_peakcall", script.get(0));
        assertEquals(3, Files.readAllLines(tempDir.resolve("errors.csv")).size());
    }

    @Test
    void testExecute_repeatedRunsProduceIdenticalInputs() throws Exception {
        Path reportDir = Path.of(Objects.requireNonNull(getClass().getResource("/metadata")).toURI());
        MetadataSet metadata = new PortalReportLoader(new MetadataSourceItem(reportDir, null, null, null, null, null, null))
                .load(List.of("ENCSR001EXP", "ENCSR100CTL"));
        List<ExperimentRequest> requests = List.of(ExperimentRequest.of("ENCSR001EXP", false), ExperimentRequest.of("ENCSR100CTL", true));

        ExecutionInfo first = new ChipInputBuilder(metadata, requests, 1).execute();
        ExecutionInfo second = new ChipInputBuilder(metadata, requests, 4).execute();

        assertEquals(first.configs(), second.configs());
    }
}
