package com.paxkun.binder.service.merge.exception;

public class NoFormatsSelectedException extends MergeException {

    public NoFormatsSelectedException() {
        super(MergeFailure.NO_FORMATS_SELECTED, "No image formats selected for extraction.");
    }
}
