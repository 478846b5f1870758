package com.flowgraph.analyzer;

import com.flowgraph.analyzer.graph.Graph;
import com.flowgraph.analyzer.graph.GraphPersistence;
import com.flowgraph.analyzer.ir.IrModel.FunctionIR;
import com.flowgraph.analyzer.ir.IrSerializer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FlowgraphMainTest {

    @TempDir
    Path dir;

    private static void assertUsage(String expectedMessage, String... args) {
        FlowgraphMain.UsageException e = assertThrows(FlowgraphMain.UsageException.class, () -> FlowgraphMain.run(args));
        assertTrue(e.getMessage().contains(expectedMessage), e.getMessage());
    }

    @Test
    void rejectsBadCommandLines() {
        assertUsage("No subcommand");
        assertUsage("Unknown subcommand", "build");
        assertUsage("--project is required", "analyze", "--trees", "t");
        assertUsage("--trees is required", "analyze", "--project", dir.toString());
        assertUsage("Unknown flag", "analyze", "--verbose");
        assertUsage("requires an argument", "analyze", "--project");
        assertUsage("does not exist", "analyze", "--project", dir.resolve("missing").toString(), "--trees", "t");
    }

    private Path prepareProject() throws IOException, URISyntaxException {
        Path project = Files.createDirectories(dir.resolve("proj/core"));
        Files.writeString(project.resolve("engine.cc"), "namespace app { class Engine { int run(int steps); }; }\n");
        Path trees = Files.createDirectories(dir.resolve("trees/core"));
        Path fixture = Path.of(FlowgraphMainTest.class.getResource("/trees/engine.cc.json").toURI());
        Files.copy(fixture, trees.resolve("engine.cc.json"));
        return dir.resolve("proj");
    }

    @Test
    void analyzeWritesIrAndGraphs() throws Exception {
        Path project = prepareProject();
        Path out = dir.resolve("out");

        FlowgraphMain.run(new String[]{"analyze", "--project", project.toString(),
                "--trees", dir.resolve("trees").toString(), "--output", out.toString()});

        Map<String, FunctionIR> functions = new IrSerializer().loadFunctions(out);
        FunctionIR run = functions.get("func_app_Engine_run_engine");
        assertNotNull(run);
        assertEquals("int run(int steps)", run.signature);
        assertEquals("core/engine.cc", run.file);
        assertTrue(new IrSerializer().loadProject(out).isPresent());

        Map<String, Graph> graphs = new GraphPersistence().loadGraphs(out.resolve("graphs"));
        assertTrue(graphs.keySet().containsAll(List.of("call_graph", "qualified_call_graph", "module_graph")));
        assertTrue(graphs.get("qualified_call_graph").hasEdge("app::Engine::run", "tick"));
        Graph cfg = new GraphPersistence().load(out.resolve("graphs/cfg/func_app_Engine_run_engine.json")).orElseThrow();
        assertTrue(cfg.hasNode("func_app_Engine_run_engine_entry"));
    }

    @Test
    void secondRunUsesCacheUnlessForced() throws Exception {
        Path project = prepareProject();
        Path out = dir.resolve("out");
        String[] args = {"analyze", "--project", project.toString(),
                "--trees", dir.resolve("trees").toString(), "--output", out.toString()};
        FlowgraphMain.run(args);
        Path moduleGraph = out.resolve("graphs/module_graph.json");
        Files.delete(moduleGraph);

        FlowgraphMain.run(args);
        assertFalse(Files.exists(moduleGraph));

        String[] forced = {"analyze", "--project", project.toString(),
                "--trees", dir.resolve("trees").toString(), "--output", out.toString(), "--force"};
        FlowgraphMain.run(forced);
        assertTrue(Files.exists(moduleGraph));
    }
}
