package io.chatflow.core.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Kahn's-algorithm linear ordering for lint and preview tooling.
///
/// The execution engine never uses this order: branching is decided per turn.
///
/// @implNote Zero in-degree nodes are seeded in declaration order, which makes
/// the ordering deterministic. Stateless and thread-safe.
public final class TopologicalSorter {

    /// Orders the graph's nodes so that every edge points forward.
    ///
    /// @param graph the graph to order, not null
    /// @return all node ids in topological order, or empty if the graph has a cycle
    public Optional<List<String>> sort(Graph graph) {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (String id : graph.getNodes().keySet()) {
            inDegree.put(id, graph.getReverseAdjacency().getOrDefault(id, List.of()).size());
        }

        Deque<String> ready = new ArrayDeque<>();
        inDegree.forEach(
                (id, degree) -> {
                    if (degree == 0) {
                        ready.add(id);
                    }
                });

        List<String> ordered = new ArrayList<>(inDegree.size());
        while (!ready.isEmpty()) {
            String current = ready.poll();
            ordered.add(current);
            for (String next : graph.successors(current)) {
                int remaining = inDegree.merge(next, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(next);
                }
            }
        }

        return ordered.size() == graph.size() ? Optional.of(List.copyOf(ordered)) : Optional.empty();
    }
}
