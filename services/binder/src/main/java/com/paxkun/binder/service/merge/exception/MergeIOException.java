package com.paxkun.binder.service.merge.exception;

/**
 * Writing the staging area or the output archive failed.
 */
public class MergeIOException extends MergeException {

    public MergeIOException(String message) {
        super(MergeFailure.IO_FAILURE, message);
    }

    public MergeIOException(String message, Throwable cause) {
        super(MergeFailure.IO_FAILURE, message, cause);
    }
}
