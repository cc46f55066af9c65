package com.paxkun.binder.service.merge.exception;

/**
 * A source holds no qualifying image entries, or none survived processing.
 */
public class EmptyArchiveException extends MergeException {

    public EmptyArchiveException(String message) {
        super(MergeFailure.EMPTY_ARCHIVE, message);
    }
}
