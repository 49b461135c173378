package com.dataworks.orchestrator.conversation;

/** A session already has a running task; turns are never interleaved. */
public class SessionBusyException extends RuntimeException {

    private final String sessionId;

    public SessionBusyException(String sessionId) {
        super("Session is busy: " + sessionId);
        this.sessionId = sessionId;
    }

    public String sessionId() { return sessionId; }
}
