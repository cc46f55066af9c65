package com.paxkun.binder.service.merge.exception;

/**
 * Failure kinds reported by the merge and extraction engine.
 */
public enum MergeFailure {
    UNREADABLE_ARCHIVE,
    EMPTY_ARCHIVE,
    CORRUPT_ENTRY,
    PATH_REJECTED,
    NO_FORMATS_SELECTED,
    OPERATION_IN_PROGRESS,
    CANCELLED,
    IO_FAILURE
}
