package com.dataworks.orchestrator.capability;

/**
 * Thrown inside a capability when it cannot complete.
 *
 * Unchecked; the registry catches it and turns it into a failed
 * {@link CapabilityResult} so the loop records it as an observation.
 */
public class CapabilityException extends RuntimeException {

    public enum Kind { INVALID_ARGUMENT, EXECUTION_ERROR, TIMEOUT, POLICY_VIOLATION }

    private final Kind kind;

    public CapabilityException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CapabilityException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
