package com.flowgraph.analyzer;

import com.flowgraph.analyzer.call_graph.CallKind;
import com.flowgraph.analyzer.cfg.CfgBuilder;
import com.flowgraph.analyzer.cfg.CfgNodeKind;
import com.flowgraph.analyzer.graph.Graph;
import com.flowgraph.analyzer.graph.GraphBuilder;
import com.flowgraph.analyzer.graph.GraphUtils;
import com.flowgraph.analyzer.ir.AstToIrTransformer;
import com.flowgraph.analyzer.ir.IrModel.BlockType;
import com.flowgraph.analyzer.ir.IrModel.FunctionIR;
import com.flowgraph.analyzer.ir.IrModel.ModuleIR;
import com.flowgraph.analyzer.syntax.SyntaxNode;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.flowgraph.analyzer.TestTrees.*;
import static org.junit.jupiter.api.Assertions.*;

class GraphBuilderTest {

    private final GraphBuilder builder = new GraphBuilder();

    private static FunctionIR ir(SyntaxNode fn) {
        String name = fn.function().orElseThrow().name();
        AstToIrTransformer transformer = new AstToIrTransformer(Path.of("/p"));
        return transformer.transformFunction(fn, new CfgBuilder().build(fn, name, "m.cc"),
                Path.of("/p/m.cc"), null, null);
    }

    private static String nodeLabelled(Graph graph, String label) {
        for (String id : graph.nodeIds()) {
            if (label.equals(graph.attributes(id).get("label").getAsString())) return id;
        }
        throw new AssertionError("no node labelled " + label);
    }

    private static String edgeType(Graph graph, String source, String target) {
        for (Graph.Edge e : graph.outEdges(source)) {
            if (e.target().equals(target)) return e.type();
        }
        return null;
    }

    @Test
    void ifBlockWiresTrueAndFalseAndReturnsToExit() {
        FunctionIR fn = ir(function("f",
                ifStmt(condition("x>0"), block(ret("1"))),
                ret("0")));

        Graph graph = builder.buildCfgGraph(fn);

        String entry = fn.id + "_entry";
        String exit = fn.id + "_exit";
        String ifNode = nodeLabelled(graph, "If: (x>0)");
        assertEquals("if", graph.attributes(ifNode).get("type").getAsString());
        assertEquals("(x>0)", graph.attributes(ifNode).get("condition").getAsString());
        assertEquals(fn.id, graph.attributes(ifNode).get("function_id").getAsString());
        assertEquals("normal", edgeType(graph, entry, ifNode));

        List<String> successors = graph.successors(ifNode);
        assertEquals(2, successors.size());
        assertEquals("true", edgeType(graph, ifNode, successors.get(0)));
        assertEquals("false", edgeType(graph, ifNode, successors.get(1)));
        for (String ret : successors) {
            assertEquals("return", edgeType(graph, ret, exit));
        }
        assertEquals(List.of(entry), GraphUtils.entryNodes(graph));
        assertEquals(List.of(exit), GraphUtils.exitNodes(graph));
    }

    @Test
    void loopBodyHasBackEdgeAndLoopExitContinues() {
        FunctionIR fn = ir(function("f",
                stmt("init();"),
                whileLoop(condition("more"), block(stmt("step();"), stmt("yield();"))),
                stmt("cleanup();")));

        Graph graph = builder.buildCfgGraph(fn);

        String init = nodeLabelled(graph, "init();");
        String loop = nodeLabelled(graph, "While Loop Entry");
        String step = nodeLabelled(graph, "step();");
        String yield = nodeLabelled(graph, "yield();");
        String cleanup = nodeLabelled(graph, "cleanup();");
        assertEquals("loop", graph.attributes(loop).get("type").getAsString());
        assertEquals("normal", edgeType(graph, init, loop));
        assertEquals("normal", edgeType(graph, loop, step));
        assertEquals("normal", edgeType(graph, step, yield));
        assertEquals("back_edge", edgeType(graph, yield, loop));
        assertEquals("loop_exit", edgeType(graph, loop, cleanup));
        assertEquals("normal", edgeType(graph, cleanup, fn.id + "_exit"));

        assertEquals(1, GraphUtils.backEdges(graph).size());
        assertTrue(GraphUtils.validate(graph).valid());
    }

    @Test
    void wireNamesIgnoreDefaultLocale() {
        Locale saved = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            SyntaxNode fn = function("f", ifStmt(condition("x"), block(stmt("tick();"))), ret("0"));
            Graph cfgGraph = new CfgBuilder().build(fn, "f", "m.cc").toGraph();
            Graph blockGraph = builder.buildCfgGraph(ir(fn));

            assertEquals("exit", cfgGraph.attributes("f_exit").get("type").getAsString());
            assertEquals("if", blockGraph.attributes(nodeLabelled(blockGraph, "If: (x)")).get("type").getAsString());
            assertEquals("exit", CfgNodeKind.EXIT.wireName());
            assertEquals("direct", CallKind.DIRECT.wireName());
            assertEquals("if", BlockType.IF.wireName());
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    void emptyFunctionIsEntryToExit() {
        FunctionIR fn = ir(function("noop"));

        Graph graph = builder.buildCfgGraph(fn);

        assertEquals(2, graph.nodeCount());
        assertEquals("normal", edgeType(graph, fn.id + "_entry", fn.id + "_exit"));
        assertEquals("Entry: noop", graph.attributes(fn.id + "_entry").get("label").getAsString());
    }

    @Test
    void callGraphLinksMatchingNamesOnly() {
        FunctionIR a = ir(function("a", callStmt("b"), callStmt("printf")));
        FunctionIR b = ir(function("b", callStmt("a")));
        Map<String, FunctionIR> functions = new LinkedHashMap<>();
        functions.put(a.id, a);
        functions.put(b.id, b);

        Graph graph = builder.buildCallGraph(functions);

        assertEquals(2, graph.nodeCount());
        assertEquals("call", edgeType(graph, a.id, b.id));
        assertEquals("call", edgeType(graph, b.id, a.id));
        assertEquals(2, graph.edgeCount());
        assertEquals("void a(void)", graph.attributes(a.id).get("signature").getAsString());
        assertEquals(1, GraphUtils.validate(graph).warnings().size());
    }

    @Test
    void moduleGraphSkipsSelfAndUnknownDependencies() {
        Map<String, ModuleIR> modules = new LinkedHashMap<>();
        modules.put("module_core", module("core", "util", "core", "missing"));
        modules.put("module_util", module("util"));

        Graph graph = builder.buildModuleGraph(modules);

        assertEquals(1, graph.edgeCount());
        assertEquals("depends_on", edgeType(graph, "module_core", "module_util"));
        assertEquals("util", graph.attributes("module_util").get("name").getAsString());
    }

    private static ModuleIR module(String name, String... deps) {
        ModuleIR m = new ModuleIR();
        m.id = "module_" + name;
        m.name = name;
        m.path = "/p/" + name;
        m.dependencies.addAll(List.of(deps));
        return m;
    }
}
