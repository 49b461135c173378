package com.dataworks.orchestrator.agent;

import com.dataworks.orchestrator.conversation.Turn;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Terminal state of a run, handed to the {@link ResultReporter}.
 *
 * @param answer final answer text; set only for SUCCESS
 * @param reason why the run stopped; set for EXHAUSTED and FATAL
 * @param turns  the turns appended by this run, in order
 */
public record RunReport(UUID taskId,
                        String sessionId,
                        RunOutcome outcome,
                        String answer,
                        String reason,
                        int iterations,
                        Duration elapsed,
                        List<Turn> turns) {

    public RunReport {
        turns = turns == null ? List.of() : List.copyOf(turns);
    }

    public static RunReport success(UUID taskId, String sessionId, String answer,
                                    int iterations, Duration elapsed, List<Turn> turns) {
        return new RunReport(taskId, sessionId, RunOutcome.SUCCESS, answer, null, iterations, elapsed, turns);
    }

    public static RunReport exhausted(UUID taskId, String sessionId, String reason,
                                      int iterations, Duration elapsed, List<Turn> turns) {
        return new RunReport(taskId, sessionId, RunOutcome.EXHAUSTED, null, reason, iterations, elapsed, turns);
    }

    public static RunReport fatal(UUID taskId, String sessionId, String reason,
                                  int iterations, Duration elapsed, List<Turn> turns) {
        return new RunReport(taskId, sessionId, RunOutcome.FATAL, null, reason, iterations, elapsed, turns);
    }
}
