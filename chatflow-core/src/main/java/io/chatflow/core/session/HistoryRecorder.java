package io.chatflow.core.session;

/// Write side of a history store, used by {@link ChatflowSession} after a turn completes.
@FunctionalInterface
public interface HistoryRecorder {

    /// Appends a message to a session's history.
    ///
    /// @param sessionId the session identifier, not null
    /// @param turn the message to append, not null
    void record(String sessionId, ConversationTurn turn);
}
