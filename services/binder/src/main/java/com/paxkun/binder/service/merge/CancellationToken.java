package com.paxkun.binder.service.merge;

import com.paxkun.binder.service.merge.exception.MergeCancelledException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation flag shared between the caller and the worker. The engine
 * checks it at every entry boundary.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    void throwIfCancelled(String where) {
        if (cancelled.get()) {
            throw new MergeCancelledException("Cancelled while " + where);
        }
    }
}
