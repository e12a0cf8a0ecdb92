package com.tightzone.screener;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation token, checked before each page request.
 */
public final class ScanCancellation {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
