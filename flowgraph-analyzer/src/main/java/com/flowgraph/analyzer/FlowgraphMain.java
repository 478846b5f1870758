package com.flowgraph.analyzer;

import com.flowgraph.analyzer.config.AnalysisConfig;
import com.flowgraph.analyzer.config.ConfigReader;
import com.flowgraph.analyzer.graph.Graph;
import com.flowgraph.analyzer.graph.GraphBuilder;
import com.flowgraph.analyzer.graph.GraphPersistence;
import com.flowgraph.analyzer.graph.GraphUtils;
import com.flowgraph.analyzer.ir.IrModel.FunctionIR;
import com.flowgraph.analyzer.ir.IrModel.ModuleIR;
import com.flowgraph.analyzer.ir.IrSerializer;
import com.flowgraph.analyzer.pipeline.AnalysisResult;
import com.flowgraph.analyzer.pipeline.ProjectAnalyzer;
import com.flowgraph.analyzer.syntax.DumpDirectoryTreeProvider;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command-line entry point.
 *
 * Usage:
 *   java -jar flowgraph-analyzer.jar analyze \
 *     --project <project-dir> \
 *     --trees   <syntax-tree-dump-dir> \
 *     [--config <config.json>] [--output <dir>] [--force]
 */
public class FlowgraphMain {

    public static void main(String[] args) {
        try {
            run(args);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[flowgraph] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar flowgraph-analyzer.jar analyze " +
                               "--project <dir> --trees <dir> [--config <file>] [--output <dir>] [--force]");
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[flowgraph] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static void run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        if (!args[0].equals("analyze")) {
            throw new UsageException("Unknown subcommand: " + args[0]);
        }

        String projectDir = null;
        String treesDir = null;
        String configPath = null;
        String outputDir = null;
        boolean force = false;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--project" -> projectDir = requireNext(args, i++, "--project");
                case "--trees"   -> treesDir   = requireNext(args, i++, "--trees");
                case "--config"  -> configPath = requireNext(args, i++, "--config");
                case "--output"  -> outputDir  = requireNext(args, i++, "--output");
                case "--force"   -> force = true;
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }

        if (projectDir == null) throw new UsageException("--project is required");
        if (treesDir == null)   throw new UsageException("--trees is required");

        Path project = Paths.get(projectDir).toAbsolutePath().normalize();
        if (!Files.isDirectory(project)) {
            throw new UsageException("Project directory does not exist: " + project);
        }
        Path trees = Paths.get(treesDir).toAbsolutePath().normalize();

        // 1. Configuration
        AnalysisConfig config = configPath != null
                ? new ConfigReader().read(Paths.get(configPath))
                : ConfigReader.defaults();
        Path output = outputDir != null ? Paths.get(outputDir) : config.getCacheDir(project);

        // 2. Cached results
        IrSerializer serializer = new IrSerializer();
        if (!force) {
            Map<String, FunctionIR> functions = serializer.loadFunctions(output);
            Map<String, ModuleIR> modules = serializer.loadModules(output);
            if (!functions.isEmpty() && !modules.isEmpty()) {
                System.err.println("[flowgraph] Loaded cached analysis results: "
                        + functions.size() + " functions, " + modules.size() + " modules (use --force to rebuild)");
                return;
            }
        }

        // 3. Analysis
        System.err.println("[flowgraph] Analyzing project: " + project);
        AnalysisResult result = new ProjectAnalyzer(new DumpDirectoryTreeProvider(project, trees), config)
                .analyze(project);

        // 4. IR
        System.err.println("[flowgraph] Writing output to: " + output);
        serializer.saveFunctions(result.functions(), output);
        serializer.saveModules(result.modules(), output);
        serializer.saveProject(result.project(), output);

        // 5. Graphs
        GraphBuilder graphBuilder = new GraphBuilder();
        Map<String, Graph> graphs = new LinkedHashMap<>();
        graphs.put("call_graph", graphBuilder.buildCallGraph(result.functions()));
        graphs.put("qualified_call_graph", result.callGraph().toGraph());
        graphs.put("module_graph", graphBuilder.buildModuleGraph(result.modules()));
        GraphPersistence persistence = new GraphPersistence();
        persistence.saveGraphs(graphs, output.resolve("graphs"));

        Map<String, Graph> cfgGraphs = new LinkedHashMap<>();
        for (FunctionIR function : result.functions().values()) {
            cfgGraphs.put(function.id, graphBuilder.buildCfgGraph(function));
        }
        persistence.saveGraphs(cfgGraphs, output.resolve("graphs").resolve("cfg"));

        for (Map.Entry<String, Graph> e : graphs.entrySet()) {
            GraphUtils.ValidationResult v = GraphUtils.validate(e.getValue());
            System.err.println("[flowgraph] " + e.getKey() + ": " + e.getValue().nodeCount() + " nodes, "
                    + e.getValue().edgeCount() + " edges, " + v.errors().size() + " orphan nodes, "
                    + v.warnings().size() + " warnings");
        }

        System.err.println("[flowgraph] Done.");
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
