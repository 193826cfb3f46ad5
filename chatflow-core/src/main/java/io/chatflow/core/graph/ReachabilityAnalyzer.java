package io.chatflow.core.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Breadth-first reachability queries over a graph's adjacency.
///
/// @implNote Stateless and thread-safe.
public final class ReachabilityAnalyzer {

    /// Returns every node reachable from `from`, including `from` itself.
    ///
    /// @param graph the graph to traverse, not null
    /// @param from the traversal root, not null
    /// @return reachable ids in BFS discovery order, never null
    public Set<String> reachableFrom(Graph graph, String from) {
        Set<String> reachable = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        reachable.add(from);
        queue.add(from);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : graph.successors(current)) {
                if (reachable.add(next)) {
                    queue.add(next);
                }
            }
        }
        return Collections.unmodifiableSet(reachable);
    }

    /// Returns nodes that cannot be reached from `start`, in declaration order.
    ///
    /// @param graph the graph to inspect, not null
    /// @param start the start node id, not null
    /// @return disconnected ids, empty when every node is reachable
    public List<String> disconnectedFrom(Graph graph, String start) {
        Set<String> reachable = reachableFrom(graph, start);
        List<String> disconnected = new ArrayList<>();
        for (String id : graph.getNodes().keySet()) {
            if (!reachable.contains(id) && !id.equals(start)) {
                disconnected.add(id);
            }
        }
        return disconnected;
    }

    /// Finds the shortest path between two nodes.
    ///
    /// Ties are broken by edge declaration order.
    ///
    /// @param graph the graph to traverse, not null
    /// @param from the first node of the path, not null
    /// @param to the last node of the path, not null
    /// @return ordered node ids from `from` to `to`, or empty if `to` is unreachable
    public Optional<List<String>> shortestPath(Graph graph, String from, String to) {
        if (!graph.getNodes().containsKey(from) || !graph.getNodes().containsKey(to)) {
            return Optional.empty();
        }

        Map<String, String> parent = new HashMap<>();
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        seen.add(from);
        queue.add(from);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(to)) {
                List<String> path = new ArrayList<>();
                for (String step = to; step != null; step = parent.get(step)) {
                    path.add(step);
                }
                Collections.reverse(path);
                return Optional.of(List.copyOf(path));
            }
            for (String next : graph.successors(current)) {
                if (seen.add(next)) {
                    parent.put(next, current);
                    queue.add(next);
                }
            }
        }
        return Optional.empty();
    }
}
