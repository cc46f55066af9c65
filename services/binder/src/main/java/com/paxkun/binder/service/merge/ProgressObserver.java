package com.paxkun.binder.service.merge;

/**
 * Receives progress snapshots from the worker thread. Implementations must
 * return quickly; the worker waits for every call.
 *
 * @param <T> snapshot type
 */
@FunctionalInterface
public interface ProgressObserver<T> {

    void onProgress(T snapshot);

    static <T> ProgressObserver<T> none() {
        return snapshot -> { };
    }
}
