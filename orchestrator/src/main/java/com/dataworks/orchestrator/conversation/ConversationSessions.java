package com.dataworks.orchestrator.conversation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Session id → conversation store.
 *
 * A store is leased to one running task at a time. Leasing a busy session
 * throws {@link SessionBusyException}; the lease must be released in a
 * {@code finally} block by whoever acquired it. Sessions the server named
 * for a one-off run are discarded instead of released.
 */
@Component
public class ConversationSessions {

    private static final Logger log = LoggerFactory.getLogger(ConversationSessions.class);

    private record Session(ConversationStore store, AtomicBoolean busy) {}

    private final ConcurrentMap<String, Session> sessions = new ConcurrentHashMap<>();

    public String newSessionId() {
        return UUID.randomUUID().toString();
    }

    /** Acquire the session's store, creating the session on first use. */
    public ConversationStore lease(String sessionId) {
        Session session = sessions.computeIfAbsent(sessionId,
                id -> new Session(new ConversationStore(), new AtomicBoolean(false)));
        if (!session.busy().compareAndSet(false, true)) {
            throw new SessionBusyException(sessionId);
        }
        return session.store();
    }

    public void release(String sessionId) {
        Session session = sessions.get(sessionId);
        if (session != null) {
            session.busy().set(false);
        }
    }

    /** Release the lease and forget the session with its history. */
    public void discard(String sessionId) {
        if (sessions.remove(sessionId) != null) {
            log.debug("Discarded session {}", sessionId);
        }
    }

    public int size() {
        return sessions.size();
    }

    public Optional<ConversationStore> find(String sessionId) {
        Session session = sessionId == null ? null : sessions.get(sessionId);
        return Optional.ofNullable(session).map(Session::store);
    }

    public boolean isBusy(String sessionId) {
        Session session = sessions.get(sessionId);
        return session != null && session.busy().get();
    }

    /**
     * Clear a session's history. Unknown sessions are a no-op.
     *
     * @throws SessionBusyException if a task is running on the session
     */
    public void reset(String sessionId) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            return;
        }
        if (!session.busy().compareAndSet(false, true)) {
            throw new SessionBusyException(sessionId);
        }
        try {
            session.store().reset();
            log.info("Cleared conversation for session {}", sessionId);
        } finally {
            session.busy().set(false);
        }
    }
}
