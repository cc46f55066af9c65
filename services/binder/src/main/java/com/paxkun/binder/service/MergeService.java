package com.paxkun.binder.service;

import com.paxkun.binder.service.job.ExtractionRequest;
import com.paxkun.binder.service.job.InspectionRequest;
import com.paxkun.binder.service.job.MergeJob;
import com.paxkun.binder.service.job.MergeRequest;
import com.paxkun.binder.service.job.MergeWorker;
import com.paxkun.binder.service.merge.ArchiveReader;
import com.paxkun.binder.service.merge.CancellationToken;
import com.paxkun.binder.service.merge.ChapterGroup;
import com.paxkun.binder.service.merge.ImageFormat;
import com.paxkun.binder.service.merge.MergeEngine;
import com.paxkun.binder.service.merge.MergeOptions;
import com.paxkun.binder.service.merge.MergeResult;
import com.paxkun.binder.service.merge.OutputPaths;
import com.paxkun.binder.service.merge.SkippedItem;
import com.paxkun.binder.service.merge.SourceEntry;
import com.paxkun.binder.service.merge.SourceInspection;
import com.paxkun.binder.service.merge.SourceKind;
import com.paxkun.binder.service.merge.StagingArea;
import com.paxkun.binder.service.merge.exception.MergeCancelledException;
import com.paxkun.binder.service.merge.exception.MergeException;
import com.paxkun.binder.service.merge.exception.MergeFailure;
import com.paxkun.binder.service.merge.exception.NoFormatsSelectedException;
import com.paxkun.binder.service.merge.exception.OperationInProgressException;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Service;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Queues merge and extraction jobs on a single worker thread and tracks their status.
 * Only one job is queued or running at any time.
 */
@Service
@RequiredArgsConstructor
public class MergeService implements InitializingBean, DisposableBean {

    static final int HISTORY_LIMIT = 10;

    private final MergeEngine mergeEngine;
    private final ArchiveReader archiveReader;
    private final SettingsService settings;
    private final LoggerService logger;

    private final MergeWorker worker = MergeWorker.singleThread();
    private final AtomicReference<ActiveJob> active = new AtomicReference<>();
    private final Deque<MergeJob> history = new ConcurrentLinkedDeque<>();

    @Override
    public void afterPropertiesSet() {
        Path stagingParent = settings.getStagingRoot();
        if (stagingParent == null) {
            stagingParent = Path.of(System.getProperty("java.io.tmpdir"));
        }
        int purged = StagingArea.purgeStale(stagingParent);
        if (purged > 0) {
            logger.info("MERGE_SERVICE", "🧹 Purged " + purged + " stale staging directories from " + stagingParent);
        }
    }

    @Override
    public void destroy() {
        ActiveJob running = active.get();
        if (running != null) {
            logger.warn("MERGE_SERVICE", "⚠️ Shutting down with job " + running.job().getJobId() + " active, cancelling it");
            running.token().cancel();
        }
        worker.close();
    }

    /**
     * Validates the request, fills in defaults and queues the merge.
     *
     * @return a copy of the queued job
     * @throws OperationInProgressException when another job is queued or running
     * @throws IllegalArgumentException     when the request names no usable sources
     */
    public MergeJob queueMerge(MergeRequest request) {
        List<SourceEntry> sources = toSourceEntries(request);
        MergeOptions options = MergeOptions.builder()
                .outputPath(resolveOutputPath(request, sources))
                .selectedFormats(resolveFormats(request.getFormats()))
                .strictMode(request.getStrict() != null ? request.getStrict() : settings.isStrictMode())
                .includeComicInfo(request.getIncludeComicInfo() != null
                        ? request.getIncludeComicInfo()
                        : settings.isIncludeComicInfo())
                .overwrite(request.isOverwrite())
                .progressBatchSize(settings.getProgressBatchSize())
                .stagingRoot(settings.getStagingRoot())
                .build();

        MergeJob job = new MergeJob(MergeJob.JobKind.MERGE, options.getOutputPath().getFileName().toString());
        ActiveJob activeJob = claim(job);
        logger.info("MERGE_SERVICE", "🚀 Queued merge " + job.getJobId() + " of " + sources.size()
                + " sources into " + options.getOutputPath());
        submit(activeJob, () -> runMerge(activeJob, sources, options));
        return job.copy();
    }

    /**
     * Queues extraction of one archive into a folder of renamed pages.
     */
    public MergeJob queueExtraction(ExtractionRequest request) {
        if (request == null || request.getSource() == null || request.getSource().isBlank()) {
            throw new IllegalArgumentException("An extraction needs a source archive");
        }
        Path source = toPath(request.getSource());
        int chapter = request.getChapter() != null ? request.getChapter() : 1;
        if (chapter < 1) {
            throw new IllegalArgumentException("chapter must be 1 or greater: " + chapter);
        }
        Set<ImageFormat> formats = resolveFormats(request.getFormats());
        boolean strict = request.getStrict() != null ? request.getStrict() : settings.isStrictMode();
        Path destination = request.getDestinationDir() != null && !request.getDestinationDir().isBlank()
                ? toPath(request.getDestinationDir())
                : OutputPaths.uniqueDirectory(settings.getDefaultOutputDir(), stemOf(source));

        MergeJob job = new MergeJob(MergeJob.JobKind.EXTRACT, String.valueOf(source.getFileName()));
        ActiveJob activeJob = claim(job);
        logger.info("MERGE_SERVICE", "🚀 Queued extraction " + job.getJobId() + " of " + source + " into " + destination);
        submit(activeJob, () -> runExtraction(activeJob, source, chapter, formats, destination, strict));
        return job.copy();
    }

    /**
     * Flags the active job for cancellation. The worker stops at the next entry boundary.
     *
     * @return whether a job was active
     */
    public boolean cancel() {
        ActiveJob running = active.get();
        if (running == null) {
            logger.debug("MERGE_SERVICE", "Cancel requested with no active job");
            return false;
        }
        running.token().cancel();
        logger.info("MERGE_SERVICE", "🛑 Cancellation requested for job " + running.job().getJobId());
        return true;
    }

    /**
     * The active job, if any, followed by up to {@value #HISTORY_LIMIT} finished ones, oldest first.
     */
    public List<MergeJob> getStatuses() {
        List<MergeJob> statuses = new ArrayList<>();
        ActiveJob running = active.get();
        if (running != null) {
            statuses.add(running.job().copy());
        }
        for (MergeJob finished : history) {
            if (running == null || !finished.getJobId().equals(running.job().getJobId())) {
                statuses.add(finished.copy());
            }
        }
        statuses.sort(Comparator.comparingLong(MergeJob::getQueuedAt));
        return statuses;
    }

    public Optional<MergeJob> getStatus(String jobId) {
        return getStatuses().stream().filter(job -> job.getJobId().equals(jobId)).findFirst();
    }

    /**
     * Drops a finished job from the history. The active job is never removed.
     */
    public boolean clearStatus(String jobId) {
        boolean removed = history.removeIf(job -> job.getJobId().equals(jobId));
        logger.debug("MERGE_SERVICE", "Clear status | jobId=" + jobId + " | removed=" + removed);
        return removed;
    }

    /**
     * Checks each source without merging. Problems are reported per source, never thrown.
     */
    public List<SourceInspection> inspectSources(InspectionRequest request) {
        if (request == null || request.getSources() == null || request.getSources().isEmpty()) {
            return Collections.emptyList();
        }
        Set<ImageFormat> zipFormats = resolveFormats(request.getFormats());
        List<SourceInspection> inspections = new ArrayList<>();
        for (String raw : request.getSources()) {
            inspections.add(inspect(raw, zipFormats));
        }
        long invalid = inspections.stream().filter(inspection -> !inspection.valid()).count();
        logger.debug("MERGE_SERVICE", "Inspected " + inspections.size() + " sources | invalid=" + invalid);
        return inspections;
    }

    public List<String> supportedFormats() {
        return Arrays.stream(ImageFormat.values()).map(ImageFormat::extension).toList();
    }

    public boolean isBusy() {
        return active.get() != null;
    }

    private SourceInspection inspect(String raw, Set<ImageFormat> zipFormats) {
        Path path;
        try {
            path = Path.of(raw);
        } catch (InvalidPathException e) {
            return SourceInspection.invalid(raw, null, 0L, MergeFailure.UNREADABLE_ARCHIVE, "Invalid path: " + e.getMessage());
        }
        Optional<SourceKind> kind = SourceKind.detect(path);
        if (kind.isEmpty()) {
            return SourceInspection.invalid(raw, null, 0L, MergeFailure.UNREADABLE_ARCHIVE, "Not a .cbz or .zip file");
        }
        Set<ImageFormat> formats = kind.get() == SourceKind.CBZ ? ImageFormat.all() : zipFormats;
        return archiveReader.inspect(path, kind.get(), formats);
    }

    private void runMerge(ActiveJob activeJob, List<SourceEntry> sources, MergeOptions options) {
        MergeJob job = activeJob.job();
        try {
            job.markStarted();
            MergeResult result = mergeEngine.merge(sources, options, job::updateProgress, activeJob.token());
            job.markCompleted(result);
            logger.info("MERGE", "✅ Job " + job.getJobId() + " wrote " + result.getTotalPages() + " pages to "
                    + result.getOutputPath());
            for (SkippedItem item : result.getSkipped()) {
                logger.warn("MERGE", "⚠️ Skipped " + item.describe());
            }
        } catch (MergeCancelledException e) {
            job.markCancelled(e.getMessage(), e.getSkipped());
            logger.info("MERGE", "🛑 Job " + job.getJobId() + " cancelled");
        } catch (MergeException e) {
            job.markFailed(e.getMessage(), e.getSkipped());
            logger.error("MERGE", "❌ Job " + job.getJobId() + " failed [" + e.getFailure() + "]", e);
        } catch (RuntimeException e) {
            job.markFailed(e.getMessage(), List.of());
            logger.error("MERGE", "❌ Job " + job.getJobId() + " failed unexpectedly", e);
        } finally {
            finalizeJob(activeJob);
        }
    }

    private void runExtraction(ActiveJob activeJob, Path source, int chapter, Set<ImageFormat> formats,
                               Path destination, boolean strict) {
        MergeJob job = activeJob.job();
        List<SkippedItem> skipped = new ArrayList<>();
        try {
            job.markStarted();
            ChapterGroup group = mergeEngine.extract(source, chapter, formats, destination, strict, skipped,
                    job::updateExtraction, activeJob.token());
            job.markExtracted(group, skipped);
            logger.info("EXTRACT", "✅ Job " + job.getJobId() + " extracted " + group.size() + " pages to " + destination);
        } catch (MergeCancelledException e) {
            job.markCancelled(e.getMessage(), skipped);
            logger.info("EXTRACT", "🛑 Job " + job.getJobId() + " cancelled");
        } catch (MergeException e) {
            job.markFailed(e.getMessage(), skipped);
            logger.error("EXTRACT", "❌ Job " + job.getJobId() + " failed [" + e.getFailure() + "]", e);
        } catch (RuntimeException e) {
            job.markFailed(e.getMessage(), skipped);
            logger.error("EXTRACT", "❌ Job " + job.getJobId() + " failed unexpectedly", e);
        } finally {
            finalizeJob(activeJob);
        }
    }

    private ActiveJob claim(MergeJob job) {
        ActiveJob activeJob = new ActiveJob(job, CancellationToken.create());
        if (!active.compareAndSet(null, activeJob)) {
            throw new OperationInProgressException("A merge or extraction job is already queued or running");
        }
        return activeJob;
    }

    private void submit(ActiveJob activeJob, Runnable task) {
        try {
            worker.executor().submit(task);
        } catch (RejectedExecutionException e) {
            active.compareAndSet(activeJob, null);
            throw new IllegalStateException("Merge worker is shut down", e);
        }
    }

    private void finalizeJob(ActiveJob activeJob) {
        history.addFirst(activeJob.job().copy());
        while (history.size() > HISTORY_LIMIT) {
            history.removeLast();
        }
        active.compareAndSet(activeJob, null);
    }

    private List<SourceEntry> toSourceEntries(MergeRequest request) {
        if (request == null || request.getSources() == null || request.getSources().isEmpty()) {
            throw new IllegalArgumentException("A merge needs at least one source");
        }
        List<Integer> chapters = request.getChapters();
        if (chapters != null && !chapters.isEmpty() && chapters.size() != request.getSources().size()) {
            throw new IllegalArgumentException("Expected " + request.getSources().size()
                    + " chapter numbers but got " + chapters.size());
        }

        List<SourceEntry> entries = new ArrayList<>();
        for (int i = 0; i < request.getSources().size(); i++) {
            Path path = toPath(request.getSources().get(i));
            SourceKind kind = SourceKind.detect(path)
                    .orElseThrow(() -> new IllegalArgumentException("Not a .cbz or .zip file: " + path));
            Integer chapter = chapters != null && !chapters.isEmpty() ? chapters.get(i) : null;
            entries.add(new SourceEntry(path, i, kind, chapter));
        }
        return entries;
    }

    private Path resolveOutputPath(MergeRequest request, List<SourceEntry> sources) {
        if (request.getOutputPath() != null && !request.getOutputPath().isBlank()) {
            return OutputPaths.ensureCbzExtension(toPath(request.getOutputPath()));
        }
        Path directory = request.getOutputDir() != null && !request.getOutputDir().isBlank()
                ? toPath(request.getOutputDir())
                : settings.getDefaultOutputDir();
        String name = request.getOutputName() != null && !request.getOutputName().isBlank()
                ? request.getOutputName()
                : OutputPaths.defaultOutputName(sources);
        if (request.isOverwrite()) {
            return OutputPaths.ensureCbzExtension(directory.resolve(OutputPaths.sanitizeFileName(name)));
        }
        return OutputPaths.uniquePath(directory, name);
    }

    /**
     * {@code null} means the configured defaults; an empty list selects nothing.
     */
    private Set<ImageFormat> resolveFormats(List<String> requested) {
        if (requested == null) {
            return settings.getDefaultFormats();
        }
        if (requested.isEmpty()) {
            throw new NoFormatsSelectedException();
        }
        Set<ImageFormat> formats = EnumSet.noneOf(ImageFormat.class);
        for (String extension : requested) {
            formats.add(ImageFormat.fromExtension(extension)
                    .orElseThrow(() -> new IllegalArgumentException("Unsupported image format: " + extension)));
        }
        return formats;
    }

    private static Path toPath(String raw) {
        try {
            return Path.of(raw);
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid path: " + raw, e);
        }
    }

    private static String stemOf(Path source) {
        String name = String.valueOf(source.getFileName());
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private record ActiveJob(MergeJob job, CancellationToken token) {
    }
}
