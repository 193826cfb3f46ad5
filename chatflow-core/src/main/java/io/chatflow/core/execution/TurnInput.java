package io.chatflow.core.execution;

import io.chatflow.core.session.ConversationTurn;
import java.util.List;
import java.util.Objects;

/// Input of one conversational turn.
///
/// @param userMessage the incoming message, not null
/// @param sessionId conversation session, may be null for one-off turns
/// @param workspaceId owning workspace, may be null
/// @param history prior messages, oldest first, never null
public record TurnInput(
        String userMessage, String sessionId, String workspaceId, List<ConversationTurn> history) {

    public TurnInput {
        Objects.requireNonNull(userMessage, "userMessage must not be null");
        history = history != null ? List.copyOf(history) : List.of();
    }

    /// Creates input with only a user message.
    public static TurnInput of(String userMessage) {
        return new TurnInput(userMessage, null, null, List.of());
    }

    /// Returns a copy with the given history.
    public TurnInput withHistory(List<ConversationTurn> history) {
        return new TurnInput(userMessage, sessionId, workspaceId, history);
    }
}
