package com.dataworks.orchestrator.agent;

import java.time.Duration;
import java.time.Instant;

/**
 * Budget bookkeeping for one run. Owned by the orchestrator thread running
 * the task and dropped when the run terminates.
 */
class RunState {

    private final int     iterationCap;
    private final Instant deadline;

    private int iterations;
    private int consecutiveDecisionFailures;

    RunState(int iterationCap, Instant deadline) {
        this.iterationCap = iterationCap;
        this.deadline     = deadline;
    }

    int iterations()        { return iterations; }
    int iterationCap()      { return iterationCap; }
    Instant deadline()      { return deadline; }

    boolean capReached() {
        return iterations >= iterationCap;
    }

    boolean deadlinePassed(Instant now) {
        return !now.isBefore(deadline);
    }

    /** Time left before the deadline, never negative. */
    Duration remaining(Instant now) {
        Duration left = Duration.between(now, deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    /** Every Deciding transition consumes one iteration. */
    void beginDecision() {
        iterations++;
    }

    int recordDecisionFailure() {
        return ++consecutiveDecisionFailures;
    }

    void resetDecisionFailures() {
        consecutiveDecisionFailures = 0;
    }
}
