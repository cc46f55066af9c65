package com.paxkun.binder.service.merge;

import com.paxkun.binder.service.merge.exception.MergeFailure;

/**
 * Result of checking a source without merging it.
 */
public record SourceInspection(
        String path,
        SourceKind kind,
        boolean valid,
        int imageCount,
        long fileSize,
        MergeFailure failure,
        String reason) {

    public static SourceInspection valid(String path, SourceKind kind, int imageCount, long fileSize) {
        return new SourceInspection(path, kind, true, imageCount, fileSize, null, null);
    }

    public static SourceInspection invalid(String path, SourceKind kind, long fileSize, MergeFailure failure, String reason) {
        return new SourceInspection(path, kind, false, 0, fileSize, failure, reason);
    }
}
