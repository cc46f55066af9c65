package com.paxkun.binder.service.job;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of {@code POST /v1/merge/extract}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionRequest {

    private String source;
    private Integer chapter;
    private String destinationDir;
    private List<String> formats;
    private Boolean strict;
}
