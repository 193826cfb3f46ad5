package io.chatflow.core.session;

import io.chatflow.core.activation.ActiveChatflows;
import io.chatflow.core.execution.ChatflowEngine;
import io.chatflow.core.execution.ExecutionListener;
import io.chatflow.core.execution.TurnInput;
import io.chatflow.core.execution.result.ExecutionResult;
import io.chatflow.core.graph.Graph;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/// Convenience runner that wires history into turns.
///
/// Loads the bounded history of the session, runs the turn, and, when a
/// {@link HistoryRecorder} is configured, appends the user message and the
/// reply after a successful turn.
///
/// @implNote Thread-safe if the store and recorder are.
public final class ChatflowSession {

    private final ChatflowEngine engine;
    private final ActiveChatflows activeChatflows;
    private final HistoryStore historyStore;
    private final HistoryRecorder historyRecorder;
    private final int historyLimit;

    /// Creates a session runner.
    ///
    /// @param engine the turn engine, not null
    /// @param activeChatflows snapshot registry, not null
    /// @param historyStore read side of history, not null
    /// @param historyRecorder write side of history, may be null to keep history read-only
    /// @param historyLimit maximum number of prior messages per turn
    public ChatflowSession(
            ChatflowEngine engine,
            ActiveChatflows activeChatflows,
            HistoryStore historyStore,
            HistoryRecorder historyRecorder,
            int historyLimit) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.activeChatflows = Objects.requireNonNull(activeChatflows, "activeChatflows");
        this.historyStore = Objects.requireNonNull(historyStore, "historyStore");
        this.historyRecorder = historyRecorder;
        this.historyLimit = historyLimit;
    }

    /// Runs a turn against the chatflow's current snapshot.
    ///
    /// The snapshot is fetched once; activating a new version during the turn
    /// does not affect it.
    ///
    /// @throws NoSuchElementException if the chatflow is not active
    public ExecutionResult respond(
            String chatflowId, String sessionId, String workspaceId, String message) {
        Graph graph =
                activeChatflows
                        .current(chatflowId)
                        .orElseThrow(
                                () -> new NoSuchElementException("Chatflow not active: " + chatflowId));
        return respond(graph, sessionId, workspaceId, message, ExecutionListener.NOOP);
    }

    /// Runs a turn against a specific graph.
    public ExecutionResult respond(
            Graph graph,
            String sessionId,
            String workspaceId,
            String message,
            ExecutionListener listener) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        List<ConversationTurn> history = historyStore.loadHistory(sessionId, historyLimit);

        ExecutionResult result =
                engine.execute(graph, new TurnInput(message, sessionId, workspaceId, history), listener);

        if (result.success() && historyRecorder != null) {
            historyRecorder.record(sessionId, ConversationTurn.user(message));
            historyRecorder.record(sessionId, ConversationTurn.assistant(result.outputText()));
        }
        return result;
    }
}
