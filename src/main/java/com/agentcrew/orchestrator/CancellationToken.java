package com.agentcrew.orchestrator;

import java.util.concurrent.atomic.AtomicBoolean;

/** Cooperative cancellation flag, checked by the orchestrator between steps. */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) throw new CancellationRequestedException();
    }
}
