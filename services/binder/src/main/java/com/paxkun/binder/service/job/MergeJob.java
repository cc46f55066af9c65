package com.paxkun.binder.service.job;

import com.paxkun.binder.service.merge.ChapterGroup;
import com.paxkun.binder.service.merge.ExtractionProgress;
import com.paxkun.binder.service.merge.MergeProgress;
import com.paxkun.binder.service.merge.MergeResult;
import com.paxkun.binder.service.merge.SkippedItem;

import java.util.List;
import java.util.UUID;

/**
 * Thread-safe status of one queued merge or extraction job.
 * <p>
 * The worker thread is the only writer. Progress snapshots are immutable and
 * replaced by reference; everything else is guarded by the instance lock.
 * Callers outside the service only ever see {@link #copy()}.
 */
public class MergeJob {

    public static final String QUEUED = "queued";
    public static final String RUNNING = "running";
    public static final String COMPLETED = "completed";
    public static final String FAILED = "failed";
    public static final String CANCELLED = "cancelled";

    private final String jobId;
    private final JobKind kind;
    private final String label;
    private final long queuedAt;

    private volatile MergeProgress progress;
    private volatile ExtractionProgress extraction;

    private String status;
    private Long startedAt;
    private Long completedAt;
    private String outputPath;
    private int pagesWritten;
    private boolean comicInfoIncluded;
    private String errorMessage;
    private List<SkippedItem> skipped = List.of();
    private long lastUpdated;

    public enum JobKind {
        MERGE,
        EXTRACT
    }

    public MergeJob(JobKind kind, String label) {
        long now = System.currentTimeMillis();
        this.jobId = UUID.randomUUID().toString();
        this.kind = kind;
        this.label = label;
        this.status = QUEUED;
        this.queuedAt = now;
        this.lastUpdated = now;
    }

    private MergeJob(MergeJob source) {
        this.jobId = source.jobId;
        this.kind = source.kind;
        this.label = source.label;
        this.queuedAt = source.queuedAt;
        this.progress = source.progress;
        this.extraction = source.extraction;
        this.status = source.status;
        this.startedAt = source.startedAt;
        this.completedAt = source.completedAt;
        this.outputPath = source.outputPath;
        this.pagesWritten = source.pagesWritten;
        this.comicInfoIncluded = source.comicInfoIncluded;
        this.errorMessage = source.errorMessage;
        this.skipped = source.skipped;
        this.lastUpdated = source.lastUpdated;
    }

    private long now() {
        return System.currentTimeMillis();
    }

    public synchronized void markStarted() {
        this.startedAt = now();
        this.status = RUNNING;
        this.lastUpdated = this.startedAt;
    }

    public void updateProgress(MergeProgress snapshot) {
        this.progress = snapshot;
    }

    public void updateExtraction(ExtractionProgress snapshot) {
        this.extraction = snapshot;
    }

    public synchronized void markCompleted(MergeResult result) {
        finish(COMPLETED, null, result.getSkipped());
        this.outputPath = String.valueOf(result.getOutputPath());
        this.pagesWritten = result.getTotalPages();
        this.comicInfoIncluded = result.isComicInfoIncluded();
    }

    public synchronized void markExtracted(ChapterGroup group, List<SkippedItem> skippedItems) {
        finish(COMPLETED, null, skippedItems);
        this.outputPath = String.valueOf(group.directory());
        this.pagesWritten = group.size();
    }

    public synchronized void markFailed(String message, List<SkippedItem> skippedItems) {
        finish(FAILED, message, skippedItems);
    }

    public synchronized void markCancelled(String message, List<SkippedItem> skippedItems) {
        finish(CANCELLED, message, skippedItems);
    }

    private void finish(String terminalStatus, String message, List<SkippedItem> skippedItems) {
        long now = now();
        this.status = terminalStatus;
        this.errorMessage = message;
        this.skipped = skippedItems != null ? List.copyOf(skippedItems) : List.of();
        this.completedAt = now;
        this.lastUpdated = now;
    }

    public synchronized boolean isFinished() {
        return COMPLETED.equals(status) || FAILED.equals(status) || CANCELLED.equals(status);
    }

    public synchronized MergeJob copy() {
        return new MergeJob(this);
    }

    public String getJobId() {
        return jobId;
    }

    public JobKind getKind() {
        return kind;
    }

    public String getLabel() {
        return label;
    }

    public long getQueuedAt() {
        return queuedAt;
    }

    public MergeProgress getProgress() {
        return progress;
    }

    public ExtractionProgress getExtraction() {
        return extraction;
    }

    public synchronized String getStatus() {
        return status;
    }

    public synchronized Long getStartedAt() {
        return startedAt;
    }

    public synchronized Long getCompletedAt() {
        return completedAt;
    }

    public synchronized String getOutputPath() {
        return outputPath;
    }

    public synchronized int getPagesWritten() {
        return pagesWritten;
    }

    public synchronized boolean isComicInfoIncluded() {
        return comicInfoIncluded;
    }

    public synchronized String getErrorMessage() {
        return errorMessage;
    }

    public synchronized List<SkippedItem> getSkipped() {
        return skipped;
    }

    public synchronized long getLastUpdated() {
        return lastUpdated;
    }
}
