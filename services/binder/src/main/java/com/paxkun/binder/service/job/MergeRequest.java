package com.paxkun.binder.service.job;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of {@code POST /v1/merge}. Unset fields fall back to the service settings.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MergeRequest {

    /** Source archives in chapter order. */
    private List<String> sources;

    /** Optional explicit chapter numbers, one per source. */
    private List<Integer> chapters;

    /** Full destination path; wins over {@link #outputDir} and {@link #outputName}. */
    private String outputPath;

    private String outputDir;
    private String outputName;
    private List<String> formats;
    private Boolean strict;
    private Boolean includeComicInfo;
    private boolean overwrite;

    public MergeRequest(List<String> sources) {
        this.sources = sources;
    }
}
