package com.codeforge.orchestrator.agent;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * The run-wide iteration budget shared by every coding-loop task.
 * Each reasoning/acting iteration consumes exactly one unit.
 */
public class IterationBudget {

    private final int           limit;
    private final AtomicInteger remaining;

    public IterationBudget(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("iteration budget must be >= 1, got " + limit);
        }
        this.limit     = limit;
        this.remaining = new AtomicInteger(limit);
    }

    /** Take one unit; false once the budget is spent. */
    public boolean tryConsume() {
        while (true) {
            int current = remaining.get();
            if (current <= 0) return false;
            if (remaining.compareAndSet(current, current - 1)) return true;
        }
    }

    public int limit()     { return limit; }
    public int remaining() { return remaining.get(); }
    public int consumed()  { return limit - remaining.get(); }
}
