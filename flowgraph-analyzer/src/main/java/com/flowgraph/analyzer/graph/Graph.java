package com.flowgraph.analyzer.graph;

import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Normalized directed graph shared by control-flow, call and module graphs.
 *
 * Nodes are string ids with an open attribute bag; edges are an ordered list of
 * (source, target, attributes). Parallel edges between one pair are kept only when their
 * attributes differ. Node and edge order is insertion order.
 */
public final class Graph {

    private final Map<String, JsonObject> nodes = new LinkedHashMap<>();
    private final List<Edge> edges = new ArrayList<>();
    private final Map<String, List<Edge>> outgoing = new LinkedHashMap<>();
    private final Map<String, List<Edge>> incoming = new LinkedHashMap<>();

    public record Edge(String source, String target, JsonObject attributes) {

        public Edge {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(target, "target");
            attributes = attributes != null ? attributes : new JsonObject();
        }

        /** The {@code type} attribute, or null when absent. */
        public String type() {
            return attributes.has("type") ? attributes.get("type").getAsString() : null;
        }
    }

    /** Adds a node, or merges {@code attributes} into an existing node's attributes. */
    public void addNode(String id, JsonObject attributes) {
        Objects.requireNonNull(id, "id");
        JsonObject existing = nodes.get(id);
        if (existing == null) {
            nodes.put(id, attributes != null ? attributes : new JsonObject());
            outgoing.put(id, new ArrayList<>());
            incoming.put(id, new ArrayList<>());
        } else if (attributes != null) {
            for (String key : attributes.keySet()) {
                existing.add(key, attributes.get(key));
            }
        }
    }

    public void addNode(String id) {
        addNode(id, null);
    }

    /**
     * Adds an edge, creating missing endpoint nodes. An edge equal to an existing one is ignored.
     *
     * @return true if the edge was added
     */
    public boolean addEdge(String source, String target, JsonObject attributes) {
        Edge edge = new Edge(source, target, attributes);
        if (!nodes.containsKey(source)) addNode(source);
        if (!nodes.containsKey(target)) addNode(target);
        if (outgoing.get(source).contains(edge)) {
            return false;
        }
        edges.add(edge);
        outgoing.get(source).add(edge);
        incoming.get(target).add(edge);
        return true;
    }

    public boolean hasNode(String id) {
        return nodes.containsKey(id);
    }

    public boolean hasEdge(String source, String target) {
        List<Edge> out = outgoing.get(source);
        if (out == null) return false;
        for (Edge e : out) {
            if (e.target().equals(target)) return true;
        }
        return false;
    }

    /** Attribute bag of a node, or null for an unknown id. The returned object is live. */
    public JsonObject attributes(String id) {
        return nodes.get(id);
    }

    public Set<String> nodeIds() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    public List<Edge> edges() {
        return Collections.unmodifiableList(edges);
    }

    public List<Edge> outEdges(String id) {
        List<Edge> out = outgoing.get(id);
        return out == null ? List.of() : Collections.unmodifiableList(out);
    }

    public List<Edge> inEdges(String id) {
        List<Edge> in = incoming.get(id);
        return in == null ? List.of() : Collections.unmodifiableList(in);
    }

    public List<String> successors(String id) {
        Set<String> result = new LinkedHashSet<>();
        for (Edge e : outEdges(id)) result.add(e.target());
        return new ArrayList<>(result);
    }

    public List<String> predecessors(String id) {
        Set<String> result = new LinkedHashSet<>();
        for (Edge e : inEdges(id)) result.add(e.source());
        return new ArrayList<>(result);
    }

    public int outDegree(String id) {
        return outEdges(id).size();
    }

    public int inDegree(String id) {
        return inEdges(id).size();
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Graph)) return false;
        Graph other = (Graph) o;
        return nodes.equals(other.nodes) && edges.equals(other.edges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes.keySet(), edges.size());
    }

    @Override
    public String toString() {
        return "Graph{" + nodes.size() + " nodes, " + edges.size() + " edges}";
    }
}
