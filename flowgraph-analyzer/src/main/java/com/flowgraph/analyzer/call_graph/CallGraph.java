package com.flowgraph.analyzer.call_graph;

import com.flowgraph.analyzer.graph.Attributes;
import com.flowgraph.analyzer.graph.Graph;
import com.google.gson.JsonObject;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Whole-program call graph keyed by qualified name.
 *
 * This is the one registry shared by per-function work, so every method synchronizes on the
 * instance. A repeated call between the same pair accumulates its distinct call kinds on a
 * single edge.
 */
public class CallGraph {

    private final Map<String, JsonObject> nodes = new LinkedHashMap<>();
    private final Set<String> registered = new LinkedHashSet<>();
    private final Map<String, Map<String, Set<CallKind>>> out = new LinkedHashMap<>();
    private final Map<String, Set<String>> in = new LinkedHashMap<>();

    /** Registers a defined function; later registrations of the same key merge attributes. */
    public synchronized void addFunction(String qualifiedName, JsonObject attributes) {
        addNode(qualifiedName, attributes);
        registered.add(qualifiedName);
    }

    /** Adds a node that is not a registered definition, e.g. an external callee. */
    public synchronized void addNode(String qualifiedName, JsonObject attributes) {
        JsonObject existing = nodes.get(qualifiedName);
        if (existing == null) {
            nodes.put(qualifiedName, attributes != null ? attributes.deepCopy() : new JsonObject());
            out.put(qualifiedName, new LinkedHashMap<>());
            in.put(qualifiedName, new LinkedHashSet<>());
        } else if (attributes != null) {
            for (String key : attributes.keySet()) existing.add(key, attributes.get(key));
        }
    }

    /**
     * Adds or extends the edge {@code caller -> callee}, creating missing nodes.
     *
     * @return true if the edge gained a call kind it did not have
     */
    public synchronized boolean addCall(String caller, String callee, CallKind kind) {
        if (!nodes.containsKey(caller)) addNode(caller, null);
        if (!nodes.containsKey(callee)) addNode(callee, null);
        in.get(callee).add(caller);
        return out.get(caller).computeIfAbsent(callee, k -> new LinkedHashSet<>()).add(kind);
    }

    /** Whether {@code qualifiedName} was registered through {@link #addFunction}. */
    public synchronized boolean isRegistered(String qualifiedName) {
        return registered.contains(qualifiedName);
    }

    public synchronized boolean hasNode(String qualifiedName) {
        return nodes.containsKey(qualifiedName);
    }

    public synchronized List<String> nodes() {
        return new ArrayList<>(nodes.keySet());
    }

    public synchronized JsonObject attributes(String qualifiedName) {
        JsonObject attrs = nodes.get(qualifiedName);
        return attrs != null ? attrs.deepCopy() : null;
    }

    public synchronized int edgeCount() {
        int count = 0;
        for (Map<String, Set<CallKind>> targets : out.values()) count += targets.size();
        return count;
    }

    public synchronized boolean hasEdge(String caller, String callee) {
        Map<String, Set<CallKind>> targets = out.get(caller);
        return targets != null && targets.containsKey(callee);
    }

    /** Distinct call kinds observed on an edge, empty if there is no such edge. */
    public synchronized Set<CallKind> callKinds(String caller, String callee) {
        Map<String, Set<CallKind>> targets = out.get(caller);
        if (targets == null || !targets.containsKey(callee)) return Set.of();
        return new LinkedHashSet<>(targets.get(callee));
    }

    /** Functions called by {@code name}; empty for unknown names. */
    public synchronized List<String> callees(String name) {
        Map<String, Set<CallKind>> targets = out.get(name);
        return targets == null ? List.of() : new ArrayList<>(targets.keySet());
    }

    /** Functions that call {@code name}; empty for unknown names. */
    public synchronized List<String> callers(String name) {
        Set<String> sources = in.get(name);
        return sources == null ? List.of() : new ArrayList<>(sources);
    }

    /**
     * Callers before callees. Recursive call chains make a true order impossible; in that case
     * every node is listed in insertion order instead of failing.
     */
    public synchronized List<String> topologicalOrder() {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (String n : nodes.keySet()) inDegree.put(n, 0);
        for (Map<String, Set<CallKind>> targets : out.values()) {
            for (String t : targets.keySet()) inDegree.merge(t, 1, Integer::sum);
        }
        Deque<String> ready = new ArrayDeque<>();
        for (Map.Entry<String, Integer> e : inDegree.entrySet()) {
            if (e.getValue() == 0) ready.add(e.getKey());
        }
        List<String> order = new ArrayList<>(nodes.size());
        while (!ready.isEmpty()) {
            String n = ready.poll();
            order.add(n);
            for (String t : out.get(n).keySet()) {
                if (inDegree.merge(t, -1, Integer::sum) == 0) ready.add(t);
            }
        }
        if (order.size() < nodes.size()) {
            return new ArrayList<>(nodes.keySet());
        }
        return order;
    }

    /**
     * Normalized view: node attributes as registered; edge attributes {@code call_type} (first
     * kind seen) and {@code call_types} (all distinct kinds).
     */
    public synchronized Graph toGraph() {
        Graph graph = new Graph();
        for (Map.Entry<String, JsonObject> n : nodes.entrySet()) {
            graph.addNode(n.getKey(), n.getValue().deepCopy());
        }
        for (Map.Entry<String, Map<String, Set<CallKind>>> e : out.entrySet()) {
            for (Map.Entry<String, Set<CallKind>> target : e.getValue().entrySet()) {
                List<String> kinds = new ArrayList<>();
                for (CallKind k : target.getValue()) kinds.add(k.wireName());
                graph.addEdge(e.getKey(), target.getKey(),
                        Attributes.of("call_type", kinds.get(0), "call_types", kinds));
            }
        }
        return graph;
    }
}
