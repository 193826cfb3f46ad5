package io.chatflow.core.session;

import java.time.Instant;
import java.util.Objects;

/// One message of a prior conversation, as handed to the engine by the history store.
///
/// @param role who produced the message, not null
/// @param content message text, not null
/// @param timestamp when the message was produced, not null
public record ConversationTurn(Role role, String content, Instant timestamp) {

    /// Author of a conversation message.
    public enum Role {
        USER,
        ASSISTANT
    }

    public ConversationTurn {
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public static ConversationTurn user(String content) {
        return new ConversationTurn(Role.USER, content, Instant.now());
    }

    public static ConversationTurn assistant(String content) {
        return new ConversationTurn(Role.ASSISTANT, content, Instant.now());
    }
}
