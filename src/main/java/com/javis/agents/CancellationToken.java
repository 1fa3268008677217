package com.javis.agents;

import java.util.concurrent.CancellationException;

/** Cooperative stop signal handed to an agent for one attempt. */
public final class CancellationToken {

    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /** Checkpoint for agents: aborts the attempt once a cancel was requested. */
    public void throwIfCancelled() {
        if (cancelled) throw new CancellationException("task cancelled");
    }
}
