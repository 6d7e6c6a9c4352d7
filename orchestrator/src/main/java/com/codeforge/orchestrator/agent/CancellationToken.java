package com.codeforge.orchestrator.agent;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * External cancellation signal for one run. Checked at every coding-loop
 * iteration and at every stage boundary; a tool call already in flight is
 * not aborted.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
