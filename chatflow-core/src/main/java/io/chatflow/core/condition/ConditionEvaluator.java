package io.chatflow.core.condition;

import io.chatflow.core.execution.executor.ExecutionContext;
import java.util.Map;

/// Decides which branch a condition node takes.
///
/// This is the narrow, injectable seam for condition semantics: a condition
/// is an operator comparison or a named predicate, never a script.
///
/// @see DefaultConditionEvaluator
@FunctionalInterface
public interface ConditionEvaluator {

    /// Evaluates a condition node's configuration against the turn context.
    ///
    /// @param config the condition node's configuration, not null
    /// @param context the current turn's context, not null
    /// @return the outcome, never null
    /// @throws ConditionEvaluationException if the configuration cannot be evaluated
    ConditionOutcome evaluate(Map<String, Object> config, ExecutionContext context)
            throws ConditionEvaluationException;
}
