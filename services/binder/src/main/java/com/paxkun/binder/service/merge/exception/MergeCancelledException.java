package com.paxkun.binder.service.merge.exception;

public class MergeCancelledException extends MergeException {

    public MergeCancelledException(String message) {
        super(MergeFailure.CANCELLED, message);
    }
}
