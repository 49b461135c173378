package com.dataworks.orchestrator.decision;

import java.util.Map;

/**
 * What the decision function wants next: invoke a capability, or stop with
 * a final answer.
 */
public record Decision(Kind kind, String capability, Map<String, Object> arguments, String answer) {

    public enum Kind { INVOKE, FINAL }

    public static Decision invoke(String capability, Map<String, Object> arguments) {
        return new Decision(Kind.INVOKE, capability, arguments == null ? Map.of() : arguments, null);
    }

    public static Decision finalAnswer(String answer) {
        return new Decision(Kind.FINAL, null, null, answer);
    }

    public boolean isFinal() {
        return kind == Kind.FINAL;
    }
}
