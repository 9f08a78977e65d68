package com.dslforge.core.correction;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle on a running session. Cancellation is observed at the top of each
 * loop iteration, never in the middle of a stage.
 */
public final class TranspileSession {

    private final String sessionId;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public TranspileSession(String sessionId) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId must not be null");
    }

    public String getSessionId() {
        return sessionId;
    }

    /**
     * Requests cancellation. Safe to call from any thread.
     */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
