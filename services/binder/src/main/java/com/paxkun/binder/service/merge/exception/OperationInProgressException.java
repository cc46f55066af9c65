package com.paxkun.binder.service.merge.exception;

public class OperationInProgressException extends MergeException {

    public OperationInProgressException(String message) {
        super(MergeFailure.OPERATION_IN_PROGRESS, message);
    }
}
