package com.paxkun.binder.service.merge;

public enum MergePhase {
    VALIDATING,
    READING,
    EXTRACTING,
    WRITING,
    FINALIZING,
    DONE,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == CANCELLED;
    }
}
