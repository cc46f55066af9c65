package com.paxkun.binder.service;

import com.paxkun.binder.service.job.ExtractionRequest;
import com.paxkun.binder.service.job.InspectionRequest;
import com.paxkun.binder.service.job.MergeJob;
import com.paxkun.binder.service.job.MergeRequest;
import com.paxkun.binder.service.merge.ArchiveReader;
import com.paxkun.binder.service.merge.CancellationToken;
import com.paxkun.binder.service.merge.ImageExtractor;
import com.paxkun.binder.service.merge.ImageFormat;
import com.paxkun.binder.service.merge.MergeEngine;
import com.paxkun.binder.service.merge.MergeResult;
import com.paxkun.binder.service.merge.SourceInspection;
import com.paxkun.binder.service.merge.StagingArea;
import com.paxkun.binder.service.merge.ZipFixtures;
import com.paxkun.binder.service.merge.exception.MergeCancelledException;
import com.paxkun.binder.service.merge.exception.MergeFailure;
import com.paxkun.binder.service.merge.exception.NoFormatsSelectedException;
import com.paxkun.binder.service.merge.exception.OperationInProgressException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MergeServiceTest {

    @Mock
    private SettingsService settingsService;

    @Mock
    private LoggerService loggerService;

    @TempDir
    Path tempDir;

    private final ArchiveReader archiveReader = new ArchiveReader();
    private MergeService mergeService;
    private Path inputs;
    private Path outputDir;

    @BeforeEach
    void setUp() {
        inputs = tempDir.resolve("inputs");
        outputDir = tempDir.resolve("out");
        when(settingsService.getDefaultFormats()).thenReturn(ImageFormat.all());
        when(settingsService.getDefaultOutputDir()).thenReturn(outputDir);
        when(settingsService.getStagingRoot()).thenReturn(tempDir.resolve("staging"));
        when(settingsService.isStrictMode()).thenReturn(false);
        when(settingsService.isIncludeComicInfo()).thenReturn(true);
        when(settingsService.getProgressBatchSize()).thenReturn(10);
        mergeService = serviceWith(new MergeEngine(archiveReader, new ImageExtractor(archiveReader)));
    }

    @AfterEach
    void tearDown() {
        mergeService.destroy();
    }

    @Test
    void queuedMergeCompletesWithDefaultOutputName() throws Exception {
        Path first = ZipFixtures.archive(inputs, "a.cbz", "2.jpg", "1.jpg");
        Path second = ZipFixtures.archive(inputs, "b.zip", "1.png");

        MergeJob queued = mergeService.queueMerge(new MergeRequest(List.of(first.toString(), second.toString())));

        assertThat(queued.getKind()).isEqualTo(MergeJob.JobKind.MERGE);
        assertThat(queued.getLabel()).isEqualTo("merged_a.cbz");
        waitForStatus(queued.getJobId(), MergeJob.COMPLETED);

        MergeJob done = mergeService.getStatus(queued.getJobId()).orElseThrow();
        assertThat(done.getPagesWritten()).isEqualTo(3);
        assertThat(done.getOutputPath()).isEqualTo(outputDir.resolve("merged_a.cbz").toAbsolutePath().normalize().toString());
        assertThat(done.getProgress().getEntriesWritten()).isEqualTo(3);
        assertThat(ZipFixtures.entryNames(outputDir.resolve("merged_a.cbz")))
                .containsExactly("ch1_001.jpg", "ch1_002.jpg", "ch2_001.png");
    }

    @Test
    void defaultOutputNameAvoidsExistingFiles() throws Exception {
        Path source = ZipFixtures.archive(inputs, "a.cbz", "1.jpg");
        Files.createDirectories(outputDir);
        Files.writeString(outputDir.resolve("merged_a.cbz"), "taken");

        MergeJob queued = mergeService.queueMerge(new MergeRequest(List.of(source.toString())));

        assertThat(queued.getLabel()).isEqualTo("merged_a_1.cbz");
        waitForStatus(queued.getJobId(), MergeJob.COMPLETED);
        assertThat(Files.readString(outputDir.resolve("merged_a.cbz"))).isEqualTo("taken");
    }

    @Test
    void strictFailureIsRecordedOnTheJob() throws Exception {
        Path good = ZipFixtures.archive(inputs, "a.cbz", "1.jpg");
        Path broken = Files.writeString(inputs.resolve("b.cbz"), "broken");
        MergeRequest request = new MergeRequest(List.of(good.toString(), broken.toString()));
        request.setStrict(true);
        request.setOutputPath(tempDir.resolve("strict").toString());

        MergeJob queued = mergeService.queueMerge(request);
        waitForStatus(queued.getJobId(), MergeJob.FAILED);

        MergeJob failed = mergeService.getStatus(queued.getJobId()).orElseThrow();
        assertThat(failed.getErrorMessage()).contains("b.cbz");
        assertThat(Files.exists(tempDir.resolve("strict.cbz"))).isFalse();
    }

    @Test
    void lenientSkipsAreListedOnTheJob() throws Exception {
        Path good = ZipFixtures.archive(inputs, "a.cbz", "1.jpg");
        Path broken = Files.writeString(inputs.resolve("b.cbz"), "broken");

        MergeJob queued = mergeService.queueMerge(new MergeRequest(List.of(good.toString(), broken.toString())));
        waitForStatus(queued.getJobId(), MergeJob.COMPLETED);

        MergeJob done = mergeService.getStatus(queued.getJobId()).orElseThrow();
        assertThat(done.getSkipped()).singleElement().satisfies(item -> {
            assertThat(item.source()).isEqualTo("b.cbz");
            assertThat(item.failure()).isEqualTo(MergeFailure.UNREADABLE_ARCHIVE);
        });
        verify(loggerService, timeout(2000)).warn(eq("MERGE"), contains("b.cbz"));
    }

    @Test
    void secondJobIsRejectedWhileOneIsActive() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        MergeEngine blockingEngine = mock(MergeEngine.class);
        when(blockingEngine.merge(anyList(), any(), any(), any())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return MergeResult.builder().outputPath(tempDir.resolve("x.cbz")).totalPages(1).build();
        });
        mergeService.destroy();
        mergeService = serviceWith(blockingEngine);

        MergeJob first = mergeService.queueMerge(new MergeRequest(List.of("a.cbz")));

        assertThat(mergeService.isBusy()).isTrue();
        assertThatThrownBy(() -> mergeService.queueMerge(new MergeRequest(List.of("b.cbz"))))
                .isInstanceOf(OperationInProgressException.class);
        assertThatThrownBy(() -> mergeService.queueExtraction(new ExtractionRequest("c.zip", null, null, null, null)))
                .isInstanceOf(OperationInProgressException.class);

        release.countDown();
        waitForStatus(first.getJobId(), MergeJob.COMPLETED);
    }

    @Test
    void cancelFlagsTheActiveJob() throws Exception {
        MergeEngine cancellableEngine = mock(MergeEngine.class);
        when(cancellableEngine.merge(anyList(), any(), any(), any())).thenAnswer(invocation -> {
            CancellationToken token = invocation.getArgument(3);
            long deadline = System.currentTimeMillis() + 5000;
            while (!token.isCancelled() && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            throw new MergeCancelledException("Cancelled while merging a.cbz");
        });
        mergeService.destroy();
        mergeService = serviceWith(cancellableEngine);

        MergeJob queued = mergeService.queueMerge(new MergeRequest(List.of("a.cbz")));

        assertThat(mergeService.cancel()).isTrue();
        waitForStatus(queued.getJobId(), MergeJob.CANCELLED);
        assertThat(mergeService.cancel()).isFalse();
    }

    @Test
    void historyKeepsTheTenMostRecentJobs() throws Exception {
        MergeEngine quickEngine = mock(MergeEngine.class);
        when(quickEngine.merge(anyList(), any(), any(), any()))
                .thenReturn(MergeResult.builder().outputPath(tempDir.resolve("x.cbz")).totalPages(1).build());
        mergeService.destroy();
        mergeService = serviceWith(quickEngine);

        String firstJobId = null;
        for (int i = 0; i < MergeService.HISTORY_LIMIT + 2; i++) {
            MergeJob job = mergeService.queueMerge(new MergeRequest(List.of("a" + i + ".cbz")));
            if (firstJobId == null) {
                firstJobId = job.getJobId();
            }
            waitUntilIdle();
        }

        List<MergeJob> statuses = mergeService.getStatuses();
        assertThat(statuses).hasSize(MergeService.HISTORY_LIMIT);
        assertThat(statuses).extracting(MergeJob::getJobId).doesNotContain(firstJobId);
        assertThat(statuses).extracting(MergeJob::getQueuedAt).isSorted();
    }

    @Test
    void clearStatusDropsFinishedJob() throws Exception {
        Path source = ZipFixtures.archive(inputs, "a.cbz", "1.jpg");
        MergeJob queued = mergeService.queueMerge(new MergeRequest(List.of(source.toString())));
        waitForStatus(queued.getJobId(), MergeJob.COMPLETED);
        waitUntilIdle();

        assertThat(mergeService.clearStatus(queued.getJobId())).isTrue();
        assertThat(mergeService.getStatus(queued.getJobId())).isEmpty();
        assertThat(mergeService.clearStatus("unknown")).isFalse();
    }

    @Test
    void invalidRequestsAreRejectedBeforeQueueing() {
        assertThatThrownBy(() -> mergeService.queueMerge(new MergeRequest(List.of())))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> mergeService.queueMerge(new MergeRequest(List.of("notes.txt"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("notes.txt");

        MergeRequest noFormats = new MergeRequest(List.of("a.zip"));
        noFormats.setFormats(List.of());
        assertThatThrownBy(() -> mergeService.queueMerge(noFormats)).isInstanceOf(NoFormatsSelectedException.class);

        MergeRequest badFormat = new MergeRequest(List.of("a.zip"));
        badFormat.setFormats(List.of("tiff"));
        assertThatThrownBy(() -> mergeService.queueMerge(badFormat))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tiff");

        MergeRequest badChapters = new MergeRequest(List.of("a.cbz", "b.cbz"));
        badChapters.setChapters(List.of(1));
        assertThatThrownBy(() -> mergeService.queueMerge(badChapters)).isInstanceOf(IllegalArgumentException.class);

        assertThat(mergeService.isBusy()).isFalse();
        assertThat(mergeService.getStatuses()).isEmpty();
    }

    @Test
    void extractionWritesRenamedPages() throws Exception {
        Path source = ZipFixtures.archive(inputs, "chapter.zip", "a.txt", "img1.jpg", "img2.gif");
        Path destination = tempDir.resolve("pages");

        MergeJob queued = mergeService.queueExtraction(
                new ExtractionRequest(source.toString(), 3, destination.toString(), List.of("jpg"), null));

        assertThat(queued.getKind()).isEqualTo(MergeJob.JobKind.EXTRACT);
        waitForStatus(queued.getJobId(), MergeJob.COMPLETED);
        MergeJob done = mergeService.getStatus(queued.getJobId()).orElseThrow();
        assertThat(done.getPagesWritten()).isEqualTo(1);
        assertThat(done.getExtraction().getEntriesExtracted()).isEqualTo(1);
        assertThat(Files.readString(destination.resolve("ch3_001.jpg"))).isEqualTo("img1.jpg");
    }

    @Test
    void extractionDefaultsToFolderNamedAfterSource() throws Exception {
        Path source = ZipFixtures.archive(inputs, "Vol 2.zip", "1.jpg");

        MergeJob queued = mergeService.queueExtraction(new ExtractionRequest(source.toString(), null, null, null, null));
        waitForStatus(queued.getJobId(), MergeJob.COMPLETED);

        assertThat(Files.exists(outputDir.resolve("Vol 2").resolve("ch1_001.jpg"))).isTrue();
    }

    @Test
    void repeatedDefaultExtractionUsesFreshFolder() throws Exception {
        Path source = ZipFixtures.archive(inputs, "Vol 2.zip", "1.jpg");

        MergeJob first = mergeService.queueExtraction(new ExtractionRequest(source.toString(), null, null, null, null));
        waitForStatus(first.getJobId(), MergeJob.COMPLETED);
        waitUntilIdle();
        MergeJob second = mergeService.queueExtraction(new ExtractionRequest(source.toString(), null, null, null, null));
        waitForStatus(second.getJobId(), MergeJob.COMPLETED);

        assertThat(Files.exists(outputDir.resolve("Vol 2").resolve("ch1_001.jpg"))).isTrue();
        assertThat(Files.exists(outputDir.resolve("Vol 2_1").resolve("ch1_001.jpg"))).isTrue();
    }

    @Test
    void inspectSourcesReportsEachSource() throws IOException {
        Path good = ZipFixtures.archive(inputs, "a.zip", "1.jpg", "2.png");
        Path broken = Files.writeString(inputs.resolve("b.cbz"), "broken");

        List<SourceInspection> inspections = mergeService.inspectSources(
                new InspectionRequest(List.of(good.toString(), broken.toString(), "c.rar"), List.of("png")));

        assertThat(inspections).hasSize(3);
        assertThat(inspections.get(0).valid()).isTrue();
        assertThat(inspections.get(0).imageCount()).isEqualTo(1);
        assertThat(inspections.get(1).failure()).isEqualTo(MergeFailure.UNREADABLE_ARCHIVE);
        assertThat(inspections.get(2).valid()).isFalse();
        assertThat(inspections.get(2).reason()).contains(".cbz or .zip");
        assertThat(mergeService.inspectSources(new InspectionRequest())).isEmpty();
    }

    @Test
    void supportedFormatsListsEveryExtension() {
        assertThat(mergeService.supportedFormats()).containsExactly("jpg", "jpeg", "png", "webp", "gif", "bmp");
    }

    @Test
    void startupPurgesStaleStagingDirectories() throws IOException {
        Path stale = Files.createDirectories(tempDir.resolve("staging").resolve(StagingArea.PREFIX + "123"));

        mergeService.afterPropertiesSet();

        assertThat(Files.exists(stale)).isFalse();
    }

    @Test
    void shutDownServiceRejectsNewJobs() throws IOException {
        Path source = ZipFixtures.archive(inputs, "a.cbz", "1.jpg");
        mergeService.destroy();

        assertThatThrownBy(() -> mergeService.queueMerge(new MergeRequest(List.of(source.toString()))))
                .isInstanceOf(IllegalStateException.class);
        assertThat(mergeService.isBusy()).isFalse();
    }

    private MergeService serviceWith(MergeEngine engine) {
        return new MergeService(engine, archiveReader, settingsService, loggerService);
    }

    private void waitForStatus(String jobId, String expectedStatus) throws InterruptedException {
        long deadline = System.currentTimeMillis() + TimeUnit.SECONDS.toMillis(5);
        while (System.currentTimeMillis() < deadline) {
            boolean reached = mergeService.getStatuses().stream()
                    .anyMatch(job -> job.getJobId().equals(jobId) && expectedStatus.equals(job.getStatus()));
            if (reached) {
                return;
            }
            Thread.sleep(25);
        }
        throw new AssertionError("Timed out waiting for job " + jobId + " to reach status " + expectedStatus);
    }

    private void waitUntilIdle() throws InterruptedException {
        long deadline = System.currentTimeMillis() + TimeUnit.SECONDS.toMillis(5);
        while (mergeService.isBusy() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(mergeService.isBusy()).isFalse();
    }
}
