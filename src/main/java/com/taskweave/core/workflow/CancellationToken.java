package com.taskweave.core.workflow;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for one workflow run. Running units are never
 * interrupted; the orchestrator checks the flag before starting each unit.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /**
     * @return true if this call cancelled the run, false if it already was
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
