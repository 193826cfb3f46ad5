package io.chatflow.core.condition;

import io.chatflow.core.execution.executor.ExecutionContext;

/// Named, injectable predicate selectable from a condition node via `predicate: <name>`.
///
/// {@snippet :
/// ConditionPredicate needsHelp = (value, context) -> value.toLowerCase().contains("help");
/// }
@FunctionalInterface
public interface ConditionPredicate {

    /// Evaluates the predicate.
    ///
    /// @param value the node's resolved `variable` template (the user message by default), not null
    /// @param context the current turn's context, read-only use, not null
    /// @return the branch to take
    boolean test(String value, ExecutionContext context);
}
