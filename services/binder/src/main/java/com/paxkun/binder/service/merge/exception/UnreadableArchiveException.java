package com.paxkun.binder.service.merge.exception;

/**
 * A source cannot be opened or parsed as a ZIP archive.
 */
public class UnreadableArchiveException extends MergeException {

    public UnreadableArchiveException(String message) {
        super(MergeFailure.UNREADABLE_ARCHIVE, message);
    }

    public UnreadableArchiveException(String message, Throwable cause) {
        super(MergeFailure.UNREADABLE_ARCHIVE, message, cause);
    }
}
