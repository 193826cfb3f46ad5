package io.chatflow.core.execution.result;

/// Wall-clock latency of one node execution.
///
/// @param nodeId the executed node, not null
/// @param durationMs elapsed milliseconds, non-negative
public record NodeTiming(String nodeId, long durationMs) {}
