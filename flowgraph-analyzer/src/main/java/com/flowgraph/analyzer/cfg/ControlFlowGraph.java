package com.flowgraph.analyzer.cfg;

import com.flowgraph.analyzer.graph.Attributes;
import com.flowgraph.analyzer.graph.Graph;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Control-flow graph of one function. Immutable once built by {@link CfgBuilder}.
 */
public final class ControlFlowGraph {

    private final String functionName;
    private final String file;
    private final Map<String, CfgNode> nodes;
    private final List<CfgEdge> edges;
    private final Map<String, List<CfgEdge>> outgoing = new LinkedHashMap<>();
    private final Map<String, List<CfgEdge>> incoming = new LinkedHashMap<>();
    private final String entryId;
    private final String exitId;

    ControlFlowGraph(String functionName, String file, Map<String, CfgNode> nodes, List<CfgEdge> edges,
                     String entryId, String exitId) {
        this.functionName = functionName;
        this.file = file;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.edges = List.copyOf(edges);
        this.entryId = entryId;
        this.exitId = exitId;
        for (String id : this.nodes.keySet()) {
            outgoing.put(id, new ArrayList<>());
            incoming.put(id, new ArrayList<>());
        }
        for (CfgEdge e : this.edges) {
            outgoing.get(e.source()).add(e);
            incoming.get(e.target()).add(e);
        }
    }

    /** Qualified name of the function this graph belongs to. */
    public String functionName() { return functionName; }

    public String file() { return file; }

    public CfgNode entry() { return nodes.get(entryId); }

    public CfgNode exit() { return nodes.get(exitId); }

    public List<CfgNode> nodes() {
        return List.copyOf(nodes.values());
    }

    public Optional<CfgNode> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public List<CfgEdge> edges() { return edges; }

    public List<CfgEdge> outEdges(String id) {
        List<CfgEdge> out = outgoing.get(id);
        return out == null ? List.of() : Collections.unmodifiableList(out);
    }

    public List<CfgEdge> inEdges(String id) {
        List<CfgEdge> in = incoming.get(id);
        return in == null ? List.of() : Collections.unmodifiableList(in);
    }

    public List<CfgNode> nodesOfKind(CfgNodeKind kind) {
        List<CfgNode> result = new ArrayList<>();
        for (CfgNode n : nodes.values()) {
            if (n.kind() == kind) result.add(n);
        }
        return result;
    }

    public int nodeCount() { return nodes.size(); }

    public int edgeCount() { return edges.size(); }

    /**
     * Raw CFG in the normalized shape: node attributes {@code type, label, file, line} plus the
     * node's own attributes; edge attribute {@code type} plus an optional {@code label}.
     */
    public Graph toGraph() {
        Graph graph = new Graph();
        for (CfgNode n : nodes.values()) {
            JsonObject attrs = n.attributes();
            attrs.addProperty("type", n.kind().wireName());
            attrs.addProperty("label", n.label());
            attrs.addProperty("function", functionName);
            if (n.location() != null) {
                Attributes.put(attrs, "file", n.location().file());
                attrs.addProperty("line", n.location().line());
            }
            graph.addNode(n.id(), attrs);
        }
        for (CfgEdge e : edges) {
            graph.addEdge(e.source(), e.target(), Attributes.of("type", e.kind().wireName(), "label", e.label()));
        }
        return graph;
    }

    @Override
    public String toString() {
        return "ControlFlowGraph{" + functionName + ": " + nodes.size() + " nodes, " + edges.size() + " edges}";
    }
}
