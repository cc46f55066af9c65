package com.paxkun.binder.service.merge;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;
import java.util.Set;

/**
 * Per-call merge configuration. Nothing here is read from global state.
 */
@Value
@Builder(toBuilder = true)
public class MergeOptions {

    public static final int DEFAULT_PROGRESS_BATCH_SIZE = 10;

    /** Destination archive; {@code .cbz} is appended when missing. */
    @NonNull
    Path outputPath;

    /** Formats kept from ZIP sources. CBZ sources always keep every supported format. */
    @Builder.Default
    Set<ImageFormat> selectedFormats = ImageFormat.all();

    /** Fail on the first bad source or entry instead of skipping it. */
    boolean strictMode;

    /** Copy ComicInfo.xml of the first merged source when it is well-formed. */
    @Builder.Default
    boolean includeComicInfo = true;

    /** Replace an existing file at {@link #outputPath}. */
    boolean overwrite;

    /** Entries written between two WRITING snapshots. */
    @Builder.Default
    int progressBatchSize = DEFAULT_PROGRESS_BATCH_SIZE;

    /** Parent of the staging directory; the system temp directory when {@code null}. */
    Path stagingRoot;
}
