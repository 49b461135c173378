package com.dataworks.orchestrator.agent;

import com.dataworks.orchestrator.conversation.Turn;
import com.dataworks.orchestrator.conversation.TurnType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns a {@link RunReport} into the plain-text body returned to the caller.
 *
 * SUCCESS returns the answer verbatim. EXHAUSTED and FATAL return a one-line
 * reason followed by the steps that were attempted, never a stack trace.
 */
@Component
public class ResultReporter {

    private static final int MAX_ARGUMENT_CHARS = 120;

    public String format(RunReport report) {
        return switch (report.outcome()) {
            case SUCCESS   -> report.answer();
            case EXHAUSTED -> "Task stopped before completion: " + report.reason() + "."
                    + attempts(report.turns());
            case FATAL     -> "Task failed: " + report.reason() + "."
                    + attempts(report.turns());
        };
    }

    /** One line per DECISION turn, paired with the observation that followed it. */
    String attempts(List<Turn> turns) {
        StringBuilder sb = new StringBuilder();
        int step = 0;
        for (int i = 0; i < turns.size(); i++) {
            Turn turn = turns.get(i);
            if (turn.type() != TurnType.DECISION) {
                continue;
            }
            Turn observation = i + 1 < turns.size() && turns.get(i + 1).answersDecision()
                    ? turns.get(i + 1) : null;
            sb.append("\n  ").append(++step).append(". ")
              .append(turn.capability()).append(' ').append(summarize(turn.arguments()))
              .append(" -> ").append(outcome(observation));
        }
        if (step == 0) {
            return "\nNo steps were attempted.";
        }
        return "\nAttempted steps:" + sb;
    }

    private static String outcome(Turn observation) {
        if (observation == null) {
            return "no result";
        }
        return observation.failed() ? "error: " + observation.error() : "ok";
    }

    private static String summarize(Map<String, Object> arguments) {
        if (arguments == null || arguments.isEmpty()) {
            return "{}";
        }
        String text = arguments.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
        return text.length() <= MAX_ARGUMENT_CHARS
                ? text
                : text.substring(0, MAX_ARGUMENT_CHARS - 3) + "...";
    }
}
