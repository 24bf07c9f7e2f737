package com.agentsentry.evaluator.orchestration;

/**
 * Lifecycle of one evaluation run.
 *
 * @author Naveed Gung
 */
public enum RunState {
    INIT,
    PROFILING,
    ROUND_ACTIVE,
    FINALIZING,
    DONE,
    TERMINATING_EARLY,
    TERMINATED_EARLY,
    /** Scoring failed before any attempt was issued. */
    ABORTED;

    public boolean isTerminal() {
        return this == DONE || this == TERMINATED_EARLY || this == ABORTED;
    }
}
