package com.dataworks.orchestrator.sandbox;

/**
 * A path or command argument broke the sandbox policy.
 * The message is the rejection reason shown to the decision function.
 */
public class SandboxViolationException extends RuntimeException {

    public SandboxViolationException(String reason) {
        super(reason);
    }

    public String getReason() {
        return getMessage();
    }
}
