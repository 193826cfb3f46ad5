package io.chatflow.core.session;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory history store keyed by session id (default implementation).
///
/// Each session keeps at most `maxTurnsPerSession` entries; the oldest are
/// dropped on {@link #record}.
///
/// @implNote Thread-safe. Each session's list is synchronized on append and copied on read.
public final class InMemoryHistoryStore implements HistoryStore, HistoryRecorder {

    public static final int DEFAULT_MAX_TURNS_PER_SESSION = 100;

    private final Map<String, List<ConversationTurn>> sessions = new ConcurrentHashMap<>();
    private final int maxTurnsPerSession;

    public InMemoryHistoryStore() {
        this(DEFAULT_MAX_TURNS_PER_SESSION);
    }

    /// @param maxTurnsPerSession retained entries per session, not negative
    public InMemoryHistoryStore(int maxTurnsPerSession) {
        if (maxTurnsPerSession < 0) {
            throw new IllegalArgumentException(
                    "maxTurnsPerSession must not be negative: " + maxTurnsPerSession);
        }
        this.maxTurnsPerSession = maxTurnsPerSession;
    }

    @Override
    public List<ConversationTurn> loadHistory(String sessionId, int limit) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        if (limit <= 0) {
            return List.of();
        }

        List<ConversationTurn> turns = sessions.get(sessionId);
        if (turns == null) {
            return List.of();
        }
        synchronized (turns) {
            int from = Math.max(0, turns.size() - limit);
            return List.copyOf(turns.subList(from, turns.size()));
        }
    }

    @Override
    public void record(String sessionId, ConversationTurn turn) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(turn, "turn must not be null");

        List<ConversationTurn> turns =
                sessions.computeIfAbsent(sessionId, id -> Collections.synchronizedList(new ArrayList<>()));
        synchronized (turns) {
            turns.add(turn);
            int excess = turns.size() - maxTurnsPerSession;
            if (excess > 0) {
                turns.subList(0, excess).clear();
            }
        }
    }

    /// Removes a session's history.
    ///
    /// @return true if the session existed
    public boolean clear(String sessionId) {
        return sessions.remove(sessionId) != null;
    }
}
