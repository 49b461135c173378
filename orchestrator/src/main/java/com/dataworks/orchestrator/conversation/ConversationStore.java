package com.dataworks.orchestrator.conversation;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered, append-only log of turns for one session.
 *
 * The orchestrator only appends; {@link #reset()} is reserved for the
 * clear endpoint. Methods are synchronized so history can be read while a
 * run appends.
 */
public class ConversationStore {

    private final List<Turn> turns = new ArrayList<>();

    public synchronized void append(Turn turn) {
        if (turn == null) {
            throw new IllegalArgumentException("turn must not be null");
        }
        turns.add(turn);
    }

    /** The last {@code n} turns in order (fewer if the log is shorter). */
    public synchronized List<Turn> window(int n) {
        if (n <= 0) {
            return List.of();
        }
        int from = Math.max(0, turns.size() - n);
        return List.copyOf(turns.subList(from, turns.size()));
    }

    public synchronized List<Turn> full() {
        return List.copyOf(turns);
    }

    /** Turns from {@code fromIndex} to the end. */
    public synchronized List<Turn> since(int fromIndex) {
        int from = Math.min(Math.max(0, fromIndex), turns.size());
        return List.copyOf(turns.subList(from, turns.size()));
    }

    public synchronized void reset() {
        turns.clear();
    }

    public synchronized int size() {
        return turns.size();
    }
}
