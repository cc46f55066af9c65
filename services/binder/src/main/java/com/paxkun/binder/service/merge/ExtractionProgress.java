package com.paxkun.binder.service.merge;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable snapshot of a single-source extraction.
 */
@Value
@Builder(toBuilder = true)
public class ExtractionProgress {

    String sourceName;
    int entriesFound;
    int entriesExtracted;
    String currentFile;
    MergePhase phase;
    String errorMessage;
}
