package com.paxkun.binder.service.merge.exception;

/**
 * An entry or target name would escape its directory or is malformed.
 */
public class PathRejectedException extends MergeException {

    public PathRejectedException(String message) {
        super(MergeFailure.PATH_REJECTED, message);
    }
}
