package com.paxkun.binder.service.merge;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a successful merge.
 */
@Value
@Builder
public class MergeResult {

    Path outputPath;
    @Singular
    List<ChapterSummary> chapters;
    int totalPages;
    boolean comicInfoIncluded;
    @Singular("skippedItem")
    List<SkippedItem> skipped;

    public boolean hasWarnings() {
        return !skipped.isEmpty();
    }

    /**
     * Pages one source contributed.
     */
    public record ChapterSummary(int chapter, String sourceName, int pages) {
    }
}
