package com.paxkun.binder.service.merge;

import lombok.extern.slf4j.Slf4j;

/**
 * Hands snapshots to an observer and remembers the last one published.
 * An observer that throws is logged and otherwise ignored so a broken UI
 * callback cannot abort the worker.
 *
 * @param <T> snapshot type
 */
@Slf4j
final class ProgressReporter<T> {

    private final ProgressObserver<T> observer;
    private volatile T latest;

    ProgressReporter(ProgressObserver<T> observer, T initial) {
        this.observer = observer != null ? observer : ProgressObserver.none();
        this.latest = initial;
    }

    T latest() {
        return latest;
    }

    T publish(T snapshot) {
        latest = snapshot;
        try {
            observer.onProgress(snapshot);
        } catch (RuntimeException e) {
            log.warn("⚠️ Progress observer failed: {}", e.getMessage(), e);
        }
        return snapshot;
    }

    /**
     * Records a snapshot without notifying the observer; used between batch boundaries.
     */
    void publishQuietly(T snapshot) {
        latest = snapshot;
    }
}
