package com.dataworks.orchestrator.agent;

public enum RunOutcome {
    /** The decision function produced a final answer. */
    SUCCESS,
    /** Iteration cap, deadline or cancellation stopped the run. Not an error. */
    EXHAUSTED,
    /** The run could not continue (decision function kept failing, unexpected error). */
    FATAL
}
