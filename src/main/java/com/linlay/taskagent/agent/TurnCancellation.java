package com.linlay.taskagent.agent;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation flag for one turn. Checked by the orchestrator before each model round,
 * so a round already in flight always settles.
 */
public final class TurnCancellation {

    private final AtomicReference<String> reason = new AtomicReference<>();

    public static TurnCancellation none() {
        return new TurnCancellation();
    }

    public void cancel(String why) {
        reason.compareAndSet(null, why == null ? "cancelled" : why);
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String reason() {
        return reason.get();
    }
}
