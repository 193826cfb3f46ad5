package io.chatflow.core.execution.executor;

import io.chatflow.core.session.ConversationTurn;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Per-turn state threaded through node execution.
///
/// A context is created fresh for every turn by the engine and discarded when
/// the turn ends. It is never shared between turns, so it needs no locking.
///
/// ### Variables
/// Starts with the chatflow's definition-level variables. After each
/// non-terminal node, the engine stores the node's output under the node's id,
/// where later templates can address it as `{{nodeId}}`. A node revisited
/// through a cycle overwrites its own entry; no node writes another node's entry.
///
/// ### Fixed template tokens
/// - `input`, `user_message`: the turn's user message
/// - `session_id`, `workspace_id`: the turn's identifiers
///
/// @implNote **Not thread-safe**. Owned by a single turn.
/// @see io.chatflow.core.execution.ChatflowEngine
public final class ExecutionContext {

    private final String userMessage;
    private final String sessionId;
    private final String workspaceId;
    private final List<ConversationTurn> history;
    private final Duration defaultTimeout;
    private final Map<String, Object> variables;

    private ExecutionContext(Builder builder) {
        this.userMessage = Objects.requireNonNull(builder.userMessage, "userMessage required");
        this.sessionId = builder.sessionId;
        this.workspaceId = builder.workspaceId;
        this.history = List.copyOf(builder.history);
        this.defaultTimeout = builder.defaultTimeout;
        this.variables = new LinkedHashMap<>(builder.variables);
    }

    public String getUserMessage() {
        return userMessage;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getWorkspaceId() {
        return workspaceId;
    }

    /// Returns the bounded conversation history, oldest first.
    ///
    /// @return unmodifiable history, never null
    public List<ConversationTurn> getHistory() {
        return history;
    }

    /// Returns the timeout applied to blocking calls whose node sets none.
    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    /// Returns a read-only view of the turn's variables.
    ///
    /// @return unmodifiable variables view, never null
    public Map<String, Object> getVariables() {
        return Collections.unmodifiableMap(variables);
    }

    public Optional<Object> getVariable(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    /// Records a node's output so later nodes can reference it.
    ///
    /// Called by the engine only, once per node execution.
    ///
    /// @param nodeId id of the node that produced the output, not null
    /// @param output the node output, may be null
    public void recordOutput(String nodeId, Object output) {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        variables.put(nodeId, output);
    }

    /// Returns the values available to templates: variables plus the fixed tokens.
    ///
    /// Fixed tokens take precedence over variables of the same name.
    ///
    /// @return a new mutable map, never null
    public Map<String, Object> templateVariables() {
        Map<String, Object> values = new HashMap<>(variables);
        values.put("input", userMessage);
        values.put("user_message", userMessage);
        if (sessionId != null) {
            values.put("session_id", sessionId);
        }
        if (workspaceId != null) {
            values.put("workspace_id", workspaceId);
        }
        return values;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link ExecutionContext}.
    public static final class Builder {
        private String userMessage;
        private String sessionId;
        private String workspaceId;
        private List<ConversationTurn> history = List.of();
        private Duration defaultTimeout = Duration.ofSeconds(30);
        private Map<String, Object> variables = Map.of();

        private Builder() {}

        public Builder userMessage(String userMessage) {
            this.userMessage = userMessage;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder workspaceId(String workspaceId) {
            this.workspaceId = workspaceId;
            return this;
        }

        public Builder history(List<ConversationTurn> history) {
            this.history = history != null ? history : List.of();
            return this;
        }

        public Builder defaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = Objects.requireNonNull(defaultTimeout, "defaultTimeout");
            return this;
        }

        public Builder variables(Map<String, Object> variables) {
            this.variables = variables != null ? variables : Map.of();
            return this;
        }

        public ExecutionContext build() {
            return new ExecutionContext(this);
        }
    }
}
