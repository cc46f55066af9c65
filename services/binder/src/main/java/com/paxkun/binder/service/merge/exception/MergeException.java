package com.paxkun.binder.service.merge.exception;

import com.paxkun.binder.service.merge.SkippedItem;

import java.util.List;

/**
 * Base type of every failure raised by the merge engine.
 * <p>
 * A terminal failure may carry the sources and entries that were skipped
 * before the operation gave up, so callers can show the full picture.
 */
public abstract class MergeException extends RuntimeException {

    private final MergeFailure failure;
    private List<SkippedItem> skipped = List.of();

    protected MergeException(MergeFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    protected MergeException(MergeFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public MergeFailure getFailure() {
        return failure;
    }

    public List<SkippedItem> getSkipped() {
        return skipped;
    }

    public MergeException withSkipped(List<SkippedItem> skippedItems) {
        this.skipped = List.copyOf(skippedItems);
        return this;
    }
}
