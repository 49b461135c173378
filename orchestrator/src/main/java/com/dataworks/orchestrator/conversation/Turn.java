package com.dataworks.orchestrator.conversation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of a conversation.
 *
 * <ul>
 *   <li>HUMAN: {@code content} is the task text.</li>
 *   <li>DECISION: {@code capability} and {@code arguments} name the requested call.</li>
 *   <li>OBSERVATION: {@code capability} names the call it answers, {@code content}
 *       holds the rendered payload and {@code error} is set on failure or
 *       rejection. An observation with no capability reports an unparseable
 *       decision and answers no DECISION turn.</li>
 *   <li>FINAL: {@code content} is the answer.</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Turn(TurnType type,
                   String capability,
                   Map<String, Object> arguments,
                   String content,
                   String error,
                   Instant timestamp) {

    public static Turn human(String text, Instant at) {
        return new Turn(TurnType.HUMAN, null, null, text, null, at);
    }

    public static Turn decision(String capability, Map<String, Object> arguments, Instant at) {
        return new Turn(TurnType.DECISION, capability, arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments)),
                null, null, at);
    }

    public static Turn observation(String capability, String content, String error, Instant at) {
        return new Turn(TurnType.OBSERVATION, capability, null, content, error, at);
    }

    public static Turn parseFailure(String problem, Instant at) {
        return new Turn(TurnType.OBSERVATION, null, null,
                "Your last reply could not be understood. Answer with exactly one JSON action block.",
                "unparseable decision: " + problem, at);
    }

    public static Turn finalAnswer(String text, Instant at) {
        return new Turn(TurnType.FINAL, null, null, text, null, at);
    }

    /** True for observations that answer a DECISION turn. */
    @JsonIgnore
    public boolean answersDecision() {
        return type == TurnType.OBSERVATION && capability != null;
    }

    @JsonIgnore
    public boolean failed() {
        return error != null;
    }
}
