package com.missionpilot.orchestrator.agent;

import java.util.concurrent.CancellationException;

/**
 * Mission-wide cancellation flag, checked by workers before every model and tool call.
 */
public final class CancellationToken {

    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /** @throws CancellationException if the mission was cancelled or this thread interrupted */
    public void throwIfCancelled() {
        if (cancelled || Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Mission cancelled");
        }
    }
}
