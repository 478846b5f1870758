package com.flowgraph.analyzer;

import com.flowgraph.analyzer.call_graph.CallGraph;
import com.flowgraph.analyzer.call_graph.CallGraphBuilder;
import com.flowgraph.analyzer.call_graph.CallKind;
import com.flowgraph.analyzer.call_graph.FunctionFlags;
import com.flowgraph.analyzer.diagnostics.Diagnostic;
import com.flowgraph.analyzer.diagnostics.Diagnostics;
import com.flowgraph.analyzer.graph.Graph;
import com.flowgraph.analyzer.syntax.FunctionInfo;
import com.flowgraph.analyzer.syntax.SyntaxNode;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.flowgraph.analyzer.TestTrees.*;
import static org.junit.jupiter.api.Assertions.*;

class CallGraphBuilderTest {

    private final Diagnostics diagnostics = Diagnostics.silent();
    private final CallGraphBuilder builder = new CallGraphBuilder(diagnostics);

    @Test
    void qualifyOmitsMissingSegments() {
        assertEquals("ns::Cls::run", CallGraphBuilder.qualify("run", "Cls", "ns"));
        assertEquals("Cls::run", CallGraphBuilder.qualify("run", "Cls", null));
        assertEquals("ns::run", CallGraphBuilder.qualify("run", "", "ns"));
        assertEquals("run", CallGraphBuilder.qualify("run", null, null));
    }

    @Test
    void addFunctionRecordsAttributes() {
        String qn = builder.addFunction("draw", "gfx/widget.cc", "Widget", "gfx", new FunctionFlags(true, false));

        assertEquals("gfx::Widget::draw", qn);
        JsonObject attrs = builder.callGraph().attributes(qn);
        assertEquals("draw", attrs.get("function_name").getAsString());
        assertEquals("Widget", attrs.get("class_name").getAsString());
        assertEquals("gfx", attrs.get("namespace").getAsString());
        assertEquals("gfx/widget.cc", attrs.get("file").getAsString());
        assertTrue(attrs.get("is_virtual").getAsBoolean());
        assertFalse(attrs.get("is_static").getAsBoolean());
    }

    @Test
    void resolvesClassScopeBeforeNamespaceBeforeBareName() {
        builder.addFunction("helper", "a.cc", null, null, null);
        builder.addFunction("helper", "a.cc", null, "app", null);
        builder.addFunction("helper", "a.cc", "Engine", "app", null);

        assertEquals("app::Engine::helper", builder.resolveCallee("helper", "Engine", "app"));
        assertEquals("app::helper", builder.resolveCallee("helper", "Other", "app"));
        assertEquals("helper", builder.resolveCallee("helper", null, "elsewhere"));
    }

    @Test
    void classScopeFallsBackToUnqualifiedClass() {
        builder.addFunction("tick", "clock.cc", "Clock", null, null);

        assertEquals("Clock::tick", builder.resolveCallee("tick", "Clock", "sys"));
    }

    @Test
    void unresolvedCalleeBecomesBareNode() {
        SyntaxNode tree = translationUnit(function("run", callStmt("printf")));
        builder.addFunction("run", "main.cc", null, null, null);

        assertTrue(builder.extractCalls(tree, "run", "main.cc", null, null));

        CallGraph graph = builder.callGraph();
        assertTrue(graph.hasEdge("run", "printf"));
        assertTrue(graph.hasNode("printf"));
        assertFalse(graph.isRegistered("printf"));
        assertEquals(1, diagnostics.ofKind(Diagnostic.Kind.UNRESOLVED_REFERENCE).size());
    }

    @Test
    void repeatedCallsShareOneEdgeAndAccumulateKinds() {
        SyntaxNode tree = translationUnit(function("loop",
                callStmt("step"),
                callStmt("step"),
                stmt("self.step();", methodCallExpr("self", "step"))));
        builder.addFunction("loop", "a.cc", null, null, null);
        builder.addFunction("step", "a.cc", null, null, null);
        builder.extractCalls(tree, "loop", "a.cc", null, null);

        CallGraph graph = builder.callGraph();
        assertEquals(1, graph.edgeCount());
        assertEquals(Set.of(CallKind.DIRECT, CallKind.METHOD), graph.callKinds("loop", "step"));

        Graph view = graph.toGraph();
        Graph.Edge edge = view.outEdges("loop").get(0);
        assertEquals("direct", edge.attributes().get("call_type").getAsString());
        assertEquals(2, edge.attributes().getAsJsonArray("call_types").size());
    }

    @Test
    void qualifiedCallUsesLastSegment() {
        SyntaxNode tree = translationUnit(function("main", callStmt("io::flush")));
        builder.addFunction("main", "main.cc", null, "io", null);
        builder.addFunction("flush", "io.cc", null, "io", null);
        builder.extractCalls(tree, "main", "main.cc", null, "io");

        assertEquals(List.of("io::flush"), builder.callees("io::main"));
    }

    @Test
    void mutualRecursionStillProducesAnOrder() {
        SyntaxNode tree = translationUnit(
                function("a", callStmt("b")),
                function("b", callStmt("a")),
                function("c", callStmt("a")));
        for (String name : List.of("a", "b", "c")) builder.addFunction(name, "r.cc", null, null, null);
        for (String name : List.of("a", "b", "c")) builder.extractCalls(tree, name, "r.cc", null, null);

        assertTrue(builder.callGraph().hasEdge("a", "b"));
        assertTrue(builder.callGraph().hasEdge("b", "a"));
        List<String> order = builder.topologicalOrder();
        assertEquals(3, order.size());
        assertEquals(Set.of("a", "b", "c"), Set.copyOf(order));
    }

    @Test
    void acyclicOrderPutsCallersFirst() {
        SyntaxNode tree = translationUnit(
                function("leaf"),
                function("mid", callStmt("leaf")),
                function("top", callStmt("mid"), callStmt("leaf")));
        for (String name : List.of("leaf", "mid", "top")) builder.addFunction(name, "t.cc", null, null, null);
        for (String name : List.of("leaf", "mid", "top")) builder.extractCalls(tree, name, "t.cc", null, null);

        assertEquals(List.of("top", "mid", "leaf"), builder.topologicalOrder());
        assertEquals(List.of("mid", "top"), builder.callers("leaf"));
        assertEquals(List.of("mid", "leaf"), builder.callees("top"));
    }

    @Test
    void unknownNamesHaveNoNeighbours() {
        assertTrue(builder.callees("ghost").isEmpty());
        assertTrue(builder.callers("ghost").isEmpty());
    }

    @Test
    void missingFunctionIsReportedNotFound() {
        SyntaxNode tree = translationUnit(function("present"));

        assertFalse(builder.extractCalls(tree, "absent", "x.cc", null, null));
        assertEquals(1, diagnostics.ofKind(Diagnostic.Kind.NOT_FOUND).size());
        assertFalse(builder.callGraph().hasNode("absent"));
    }

    @Test
    void outOfLineDefinitionIsFoundByShortName() {
        SyntaxNode tree = translationUnit(
                function(FunctionInfo.of("Parser::next", "int"), 3, callStmt("advance")));
        builder.addFunction("next", "p.cc", "Parser", null, null);
        builder.addFunction("advance", "p.cc", "Parser", null, null);

        assertTrue(builder.extractCalls(tree, "next", "p.cc", "Parser", null));
        assertTrue(builder.callGraph().hasEdge("Parser::next", "Parser::advance"));
    }
}
