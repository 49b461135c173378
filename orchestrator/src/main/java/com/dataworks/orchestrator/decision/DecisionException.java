package com.dataworks.orchestrator.decision;

/**
 * The decision function could not produce a {@link Decision}.
 *
 * PARSE_ERROR: a reply arrived but was not a well-formed action.
 * UNAVAILABLE: the backend could not be reached or answered with an error.
 * Both are retried by the orchestrator up to its configured bound.
 */
public class DecisionException extends RuntimeException {

    public enum Kind { PARSE_ERROR, UNAVAILABLE }

    private final Kind kind;

    public DecisionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DecisionException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
