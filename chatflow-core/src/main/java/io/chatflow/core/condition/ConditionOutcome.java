package io.chatflow.core.condition;

/// Result of evaluating a condition node.
///
/// @param met whether the condition holds
/// @param rule operator wire name or `predicate:<name>`, not null
/// @param value the resolved left-hand value, not null
public record ConditionOutcome(boolean met, String rule, String value) {}
