package com.paxkun.binder.service.merge;

import java.nio.file.Path;
import java.util.List;

/**
 * The pages one source contributes to an output, in final page order.
 *
 * @param chapter    1-based chapter index
 * @param sourceName file name of the source
 * @param entries    renamed pages, sorted
 * @param directory  where the renamed page files were written
 */
public record ChapterGroup(int chapter, String sourceName, List<RenamedEntry> entries, Path directory) {

    public ChapterGroup {
        entries = List.copyOf(entries);
    }

    public Path fileOf(RenamedEntry entry) {
        return directory.resolve(entry.targetName());
    }

    public int size() {
        return entries.size();
    }
}
