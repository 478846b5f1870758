package com.flowgraph.analyzer;

import com.flowgraph.analyzer.graph.Attributes;
import com.flowgraph.analyzer.graph.Graph;
import com.flowgraph.analyzer.graph.GraphUtils;
import com.flowgraph.analyzer.graph.GraphUtils.ValidationResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GraphUtilsTest {

    private static Graph chain(String... ids) {
        Graph g = new Graph();
        for (String id : ids) g.addNode(id, Attributes.of("label", id.toUpperCase()));
        for (int i = 0; i + 1 < ids.length; i++) g.addEdge(ids[i], ids[i + 1], Attributes.of("type", "normal"));
        return g;
    }

    @Test
    void entryAndExitNodes() {
        Graph g = chain("a", "b", "c");
        g.addEdge("x", "b", null);

        assertEquals(List.of("a", "x"), GraphUtils.entryNodes(g));
        assertEquals(List.of("c"), GraphUtils.exitNodes(g));
    }

    @Test
    void reachableFollowsEdgesAndSurvivesCycles() {
        Graph g = chain("a", "b", "c");
        g.addEdge("c", "a", Attributes.of("type", "back_edge"));
        g.addNode("d");

        assertEquals(Set.of("a", "b", "c"), GraphUtils.reachable(g, "b"));
        assertEquals(Set.of("d"), GraphUtils.reachable(g, "d"));
        assertTrue(GraphUtils.reachable(g, "nope").isEmpty());
    }

    @Test
    void pruneKeepsInducedSubgraphWithCopiedAttributes() {
        Graph g = chain("a", "b", "c");

        Graph pruned = GraphUtils.prune(g, List.of("a", "b", "zz"));

        assertEquals(Set.of("a", "b"), pruned.nodeIds());
        assertEquals(1, pruned.edgeCount());
        pruned.attributes("a").addProperty("label", "changed");
        assertEquals("A", g.attributes("a").get("label").getAsString());
    }

    @Test
    void scopeSubgraphHonoursDepth() {
        Graph g = chain("a", "b", "c", "d");
        g.addEdge("a", "c", null);

        assertEquals(Set.of("a", "b", "c"), GraphUtils.subgraphByScope(g, List.of("a"), 1).nodeIds());
        assertEquals(Set.of("a"), GraphUtils.subgraphByScope(g, List.of("a"), 0).nodeIds());
        assertEquals(Set.of("a", "b", "c", "d"), GraphUtils.subgraphByScope(g, List.of("a"), null).nodeIds());
        assertEquals(Set.of("c", "d"), GraphUtils.subgraphByScope(g, List.of("c", "missing"), 5).nodeIds());
    }

    @Test
    void orphansAreErrorsAndCyclesAreWarnings() {
        Graph g = chain("a", "b");
        g.addEdge("b", "a", null);
        g.addNode("lonely");

        ValidationResult result = GraphUtils.validate(g);

        assertFalse(result.valid());
        assertEquals(List.of("Orphan node: lonely"), result.errors());
        assertEquals(List.of("Cycle through edge: b -> a", "Graph has 2 disconnected components"),
                result.warnings());
    }

    @Test
    void separateChainsWarnButStayValid() {
        Graph g = chain("a", "b");
        g.addEdge("c", "d", Attributes.of("type", "normal"));

        ValidationResult result = GraphUtils.validate(g);

        assertTrue(result.valid());
        assertTrue(result.errors().isEmpty());
        assertEquals(List.of("Graph has 2 disconnected components"), result.warnings());
    }

    @Test
    void componentsIgnoreEdgeDirection() {
        Graph g = chain("a", "b");
        g.addEdge("c", "b", null);
        assertEquals(1, GraphUtils.componentCount(g));

        g.addNode("island");
        assertEquals(2, GraphUtils.componentCount(g));
        assertEquals(0, GraphUtils.componentCount(new Graph()));
    }

    @Test
    void cyclicGraphWithoutOrphansIsValid() {
        Graph g = chain("a", "b", "c");
        g.addEdge("c", "b", null);

        ValidationResult result = GraphUtils.validate(g);

        assertTrue(result.valid());
        assertEquals(1, result.warnings().size());
    }

    @Test
    void selfLoopIsABackEdge() {
        Graph g = new Graph();
        g.addEdge("spin", "spin", null);

        assertEquals(1, GraphUtils.backEdges(g).size());
        assertTrue(GraphUtils.validate(g).valid());
    }

    @Test
    void duplicateEdgesAreIgnoredButDistinctAttributesKept() {
        Graph g = new Graph();
        assertTrue(g.addEdge("a", "b", Attributes.of("type", "true")));
        assertFalse(g.addEdge("a", "b", Attributes.of("type", "true")));
        assertTrue(g.addEdge("a", "b", Attributes.of("type", "false")));

        assertEquals(2, g.edgeCount());
        assertEquals(List.of("b"), g.successors("a"));
        assertEquals(2, g.outDegree("a"));
    }
}
