package com.paxkun.binder.service.merge.exception;

/**
 * One entry could not be read (bad CRC, truncated data, oversized).
 */
public class CorruptEntryException extends MergeException {

    public CorruptEntryException(String message) {
        super(MergeFailure.CORRUPT_ENTRY, message);
    }

    public CorruptEntryException(String message, Throwable cause) {
        super(MergeFailure.CORRUPT_ENTRY, message, cause);
    }
}
