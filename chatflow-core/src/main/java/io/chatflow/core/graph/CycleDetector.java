package io.chatflow.core.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Depth-first cycle detection with path reporting.
///
/// Keeps an on-stack set and a fully-visited set. Reaching a node that is
/// still on the active DFS stack closes a cycle; the reported path is the
/// suffix of the DFS path that starts at the repeated node.
///
/// Roots are visited in node declaration order and successors in edge
/// declaration order, so the reported cycle is deterministic.
///
/// @implNote Iterative, so deep chains do not exhaust the thread stack.
/// Runs in O(N+E). Stateless and thread-safe.
public final class CycleDetector {

    /// Outcome of cycle detection.
    ///
    /// @param hasCycle whether a cycle was found
    /// @param path the cycle in traversal order when found, empty otherwise
    public record Result(boolean hasCycle, List<String> path) {

        private static final Result NONE = new Result(false, List.of());

        public Result {
            path = List.copyOf(path);
        }

        static Result none() {
            return NONE;
        }

        static Result of(List<String> path) {
            return new Result(true, path);
        }

        public Optional<List<String>> cyclePath() {
            return hasCycle ? Optional.of(path) : Optional.empty();
        }
    }

    /// Searches the graph's adjacency for a cycle.
    ///
    /// @param graph the graph to inspect, not null
    /// @return detection result, never null
    public Result detect(Graph graph) {
        return detect(graph.getNodes().keySet(), graph.getAdjacency());
    }

    /// Searches an adjacency map for a cycle.
    ///
    /// @param declaredOrder node ids in declaration order, used for root selection
    /// @param adjacency id to ordered successor ids
    /// @return detection result, never null
    public Result detect(Iterable<String> declaredOrder, Map<String, List<String>> adjacency) {
        Set<String> visited = new HashSet<>();
        Set<String> onStack = new HashSet<>();

        for (String root : declaredOrder) {
            if (visited.contains(root)) {
                continue;
            }

            List<String> path = new ArrayList<>();
            Deque<Frame> stack = new ArrayDeque<>();
            stack.push(new Frame(root, adjacency.getOrDefault(root, List.of())));
            onStack.add(root);
            path.add(root);

            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (frame.next < frame.successors.size()) {
                    String successor = frame.successors.get(frame.next++);
                    if (onStack.contains(successor)) {
                        int from = path.indexOf(successor);
                        return Result.of(path.subList(from, path.size()));
                    }
                    if (!visited.contains(successor)) {
                        stack.push(
                                new Frame(successor, adjacency.getOrDefault(successor, List.of())));
                        onStack.add(successor);
                        path.add(successor);
                    }
                } else {
                    stack.pop();
                    onStack.remove(frame.nodeId);
                    visited.add(frame.nodeId);
                    path.remove(path.size() - 1);
                }
            }
        }
        return Result.none();
    }

    private static final class Frame {
        private final String nodeId;
        private final List<String> successors;
        private int next;

        private Frame(String nodeId, List<String> successors) {
            this.nodeId = nodeId;
            this.successors = successors;
        }
    }
}
