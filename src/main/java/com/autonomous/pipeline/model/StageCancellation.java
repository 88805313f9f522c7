package com.autonomous.pipeline.model;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation flag for one stage execution. Raised by an operator abort and
 * observed by the completion loop on its next tick.
 */
public class StageCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private volatile String reason;

    public boolean cancel(String reason) {
        if (cancelled.compareAndSet(false, true)) {
            this.reason = reason;
            return true;
        }
        return false;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public String getReason() {
        return reason;
    }
}
