package com.paxkun.binder.service.merge;

import com.paxkun.binder.service.merge.exception.MergeException;
import com.paxkun.binder.service.merge.exception.MergeFailure;

/**
 * A source or a single entry that was left out of an operation.
 *
 * @param source    file name of the source archive
 * @param entry     entry name inside the archive, {@code null} when the whole source was skipped
 * @param failure   failure kind
 * @param reason    human-readable reason
 */
public record SkippedItem(String source, String entry, MergeFailure failure, String reason) {

    public static SkippedItem ofSource(String source, MergeException e) {
        return new SkippedItem(source, null, e.getFailure(), e.getMessage());
    }

    public static SkippedItem ofEntry(String source, String entry, MergeException e) {
        return new SkippedItem(source, entry, e.getFailure(), e.getMessage());
    }

    public boolean isWholeSource() {
        return entry == null;
    }

    public String describe() {
        String target = entry == null ? source : source + " → " + entry;
        return target + ": " + reason + " (" + failure + ")";
    }
}
