package com.flowgraph.analyzer.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Operations over any normalized {@link Graph}. Every traversal carries a visited set, so
 * cyclic graphs are safe.
 */
public final class GraphUtils {

    private GraphUtils() {}

    public record ValidationResult(boolean valid, List<String> errors, List<String> warnings) {
        public ValidationResult {
            errors = List.copyOf(errors);
            warnings = List.copyOf(warnings);
        }
    }

    /** Nodes with no incoming edge. */
    public static List<String> entryNodes(Graph graph) {
        List<String> result = new ArrayList<>();
        for (String id : graph.nodeIds()) {
            if (graph.inDegree(id) == 0) result.add(id);
        }
        return result;
    }

    /** Nodes with no outgoing edge. */
    public static List<String> exitNodes(Graph graph) {
        List<String> result = new ArrayList<>();
        for (String id : graph.nodeIds()) {
            if (graph.outDegree(id) == 0) result.add(id);
        }
        return result;
    }

    /** Nodes reachable from {@code start}, including itself; empty for an unknown start. */
    public static Set<String> reachable(Graph graph, String start) {
        Set<String> visited = new LinkedHashSet<>();
        if (!graph.hasNode(start)) return visited;
        Deque<String> stack = new ArrayDeque<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            String n = stack.pop();
            if (!visited.add(n)) continue;
            List<String> next = graph.successors(n);
            for (int i = next.size() - 1; i >= 0; i--) {
                if (!visited.contains(next.get(i))) stack.push(next.get(i));
            }
        }
        return visited;
    }

    /** Induced subgraph on {@code keep}; attributes are copied. */
    public static Graph prune(Graph graph, Collection<String> keep) {
        Set<String> kept = new LinkedHashSet<>(keep);
        Graph result = new Graph();
        for (String id : graph.nodeIds()) {
            if (kept.contains(id)) result.addNode(id, graph.attributes(id).deepCopy());
        }
        for (Graph.Edge e : graph.edges()) {
            if (kept.contains(e.source()) && kept.contains(e.target())) {
                result.addEdge(e.source(), e.target(), e.attributes().deepCopy());
            }
        }
        return result;
    }

    /**
     * Induced subgraph on everything within {@code maxDepth} edges of a seed (breadth-first, so
     * each node is kept at its shortest distance). Unknown seeds are ignored; a null
     * {@code maxDepth} means unbounded.
     */
    public static Graph subgraphByScope(Graph graph, List<String> seeds, Integer maxDepth) {
        Map<String, Integer> depth = new LinkedHashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        for (String seed : seeds) {
            if (graph.hasNode(seed) && !depth.containsKey(seed)) {
                depth.put(seed, 0);
                queue.add(seed);
            }
        }
        while (!queue.isEmpty()) {
            String n = queue.poll();
            int d = depth.get(n);
            if (maxDepth != null && d >= maxDepth) continue;
            for (String s : graph.successors(n)) {
                if (!depth.containsKey(s)) {
                    depth.put(s, d + 1);
                    queue.add(s);
                }
            }
        }
        return prune(graph, depth.keySet());
    }

    /**
     * Orphan nodes (no edges at all) are errors. Cycles (one warning per back edge found by
     * depth-first search) and a graph split into several weakly connected components are
     * warnings and never make the graph invalid.
     */
    public static ValidationResult validate(Graph graph) {
        List<String> errors = new ArrayList<>();
        for (String id : graph.nodeIds()) {
            if (graph.inDegree(id) == 0 && graph.outDegree(id) == 0) {
                errors.add("Orphan node: " + id);
            }
        }
        List<String> warnings = new ArrayList<>();
        for (Graph.Edge e : backEdges(graph)) {
            warnings.add("Cycle through edge: " + e.source() + " -> " + e.target());
        }
        int components = componentCount(graph);
        if (components > 1) {
            warnings.add("Graph has " + components + " disconnected components");
        }
        return new ValidationResult(errors.isEmpty(), errors, warnings);
    }

    /** Number of weakly connected components, ignoring edge direction; 0 for an empty graph. */
    public static int componentCount(Graph graph) {
        Set<String> visited = new HashSet<>();
        int count = 0;
        for (String root : graph.nodeIds()) {
            if (!visited.add(root)) continue;
            count++;
            Deque<String> stack = new ArrayDeque<>();
            stack.push(root);
            while (!stack.isEmpty()) {
                String n = stack.pop();
                for (String s : graph.successors(n)) {
                    if (visited.add(s)) stack.push(s);
                }
                for (String p : graph.predecessors(n)) {
                    if (visited.add(p)) stack.push(p);
                }
            }
        }
        return count;
    }

    /** Edges that close a cycle in a depth-first search from every unvisited node. */
    public static List<Graph.Edge> backEdges(Graph graph) {
        final int onStack = 1;
        final int done = 2;
        Map<String, Integer> state = new HashMap<>();
        List<Graph.Edge> result = new ArrayList<>();
        for (String root : graph.nodeIds()) {
            if (state.containsKey(root)) continue;
            Deque<String> path = new ArrayDeque<>();
            Deque<Iterator<Graph.Edge>> iterators = new ArrayDeque<>();
            state.put(root, onStack);
            path.push(root);
            iterators.push(graph.outEdges(root).iterator());
            while (!path.isEmpty()) {
                Iterator<Graph.Edge> it = iterators.peek();
                if (it.hasNext()) {
                    Graph.Edge e = it.next();
                    Integer s = state.get(e.target());
                    if (s == null) {
                        state.put(e.target(), onStack);
                        path.push(e.target());
                        iterators.push(graph.outEdges(e.target()).iterator());
                    } else if (s == onStack) {
                        result.add(e);
                    }
                } else {
                    state.put(path.pop(), done);
                    iterators.pop();
                }
            }
        }
        return result;
    }
}
