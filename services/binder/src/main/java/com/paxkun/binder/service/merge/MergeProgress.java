package com.paxkun.binder.service.merge;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable snapshot of a merge. A new snapshot replaces the previous one;
 * observers may keep references safely.
 */
@Value
@Builder(toBuilder = true)
public class MergeProgress {

    int totalSources;
    int sourcesCompleted;
    String currentSource;
    int totalEntries;
    int entriesWritten;
    MergePhase phase;
    String errorMessage;

    public static MergeProgress validating(int totalSources) {
        return MergeProgress.builder()
                .totalSources(totalSources)
                .phase(MergePhase.VALIDATING)
                .build();
    }

    public MergeProgress withPhase(MergePhase nextPhase) {
        return toBuilder().phase(nextPhase).build();
    }

    public MergeProgress failed(MergePhase terminalPhase, String message) {
        return toBuilder().phase(terminalPhase).errorMessage(message).currentSource(null).build();
    }
}
