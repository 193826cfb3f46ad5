package io.chatflow.core.session;

import java.util.List;

/// Read-only access to the prior turns of a conversation session.
///
/// Storage of history is owned by the surrounding application; the engine only reads it.
///
/// @see InMemoryHistoryStore
@FunctionalInterface
public interface HistoryStore {

    /// Loads the most recent messages of a session.
    ///
    /// @param sessionId the session identifier, not null
    /// @param limit maximum number of messages to return, positive
    /// @return at most `limit` messages, oldest first, never null
    List<ConversationTurn> loadHistory(String sessionId, int limit);

    /// Store that always returns an empty history.
    HistoryStore EMPTY = (sessionId, limit) -> List.of();
}
