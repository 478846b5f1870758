package com.flowgraph.analyzer.pipeline;

import com.flowgraph.analyzer.call_graph.CallGraphBuilder;
import com.flowgraph.analyzer.call_graph.FunctionFlags;
import com.flowgraph.analyzer.cfg.CfgBuilder;
import com.flowgraph.analyzer.cfg.ControlFlowGraph;
import com.flowgraph.analyzer.config.AnalysisConfig;
import com.flowgraph.analyzer.diagnostics.Diagnostic;
import com.flowgraph.analyzer.diagnostics.Diagnostics;
import com.flowgraph.analyzer.ir.AstToIrTransformer;
import com.flowgraph.analyzer.ir.IrModel.FunctionIR;
import com.flowgraph.analyzer.ir.IrModel.ModuleIR;
import com.flowgraph.analyzer.ir.IrModel.ProjectIR;
import com.flowgraph.analyzer.modules.FileSystemSourceProvider;
import com.flowgraph.analyzer.modules.ModuleAnalysis;
import com.flowgraph.analyzer.modules.ModuleAnalyzer;
import com.flowgraph.analyzer.modules.ModuleInfo;
import com.flowgraph.analyzer.modules.ProjectPaths;
import com.flowgraph.analyzer.modules.SourceProvider;
import com.flowgraph.analyzer.syntax.FunctionSite;
import com.flowgraph.analyzer.syntax.SyntaxNode;
import com.flowgraph.analyzer.syntax.SyntaxTreeProvider;
import com.flowgraph.analyzer.syntax.SyntaxTrees;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Orchestrates a full analysis pass over a project's source files.
 *
 * Tree loading, function discovery and CFG construction run per file on a fixed worker pool.
 * Their results are merged on the calling thread in file order, so ids, registries and output
 * do not depend on scheduling. Calls are extracted only after every function is registered.
 * A file or function that fails is recorded as a diagnostic and skipped.
 */
public class ProjectAnalyzer {

    public static class AnalysisException extends RuntimeException {
        public AnalysisException(String msg, Throwable cause) { super(msg, cause); }
    }

    private final SyntaxTreeProvider trees;
    private final SourceProvider sources;
    private final AnalysisConfig config;
    private final CfgBuilder cfgBuilder = new CfgBuilder();

    public ProjectAnalyzer(SyntaxTreeProvider trees, SourceProvider sources, AnalysisConfig config) {
        this.trees = trees;
        this.sources = sources;
        this.config = config;
    }

    public ProjectAnalyzer(SyntaxTreeProvider trees, AnalysisConfig config) {
        this(trees, new FileSystemSourceProvider(), config);
    }

    /** Collects the project's files per the configured extensions and excludes, then analyzes them. */
    public AnalysisResult analyze(Path projectRoot) {
        List<Path> files = SourceFileCollector.collect(projectRoot, config.getExtensions(), config.getExcludePatterns());
        System.err.println("[flowgraph] Found " + files.size() + " source files");
        return analyze(projectRoot, files);
    }

    public AnalysisResult analyze(Path projectRoot, List<Path> files) {
        Path root = ProjectPaths.normalize(projectRoot);
        List<Path> absolute = new ArrayList<>();
        for (Path f : files) absolute.add(root.resolve(f).normalize());

        Diagnostics diagnostics = new Diagnostics(config.isVerbose());

        // 1. Modules
        System.err.println("[flowgraph] Analyzing modules...");
        ModuleAnalysis moduleAnalysis = new ModuleAnalyzer(root, sources, diagnostics).analyze(absolute);

        // 2. Per-file trees and CFGs
        System.err.println("[flowgraph] Building control-flow graphs with " + config.getWorkerThreads() + " workers...");
        List<FileUnit> units = buildUnits(root, absolute, diagnostics);

        // 3. IR and call-graph registration, in file order
        AstToIrTransformer transformer = new AstToIrTransformer(root, diagnostics);
        CallGraphBuilder callGraph = new CallGraphBuilder(diagnostics);
        Map<String, ControlFlowGraph> cfgs = new LinkedHashMap<>();
        for (FileUnit unit : units) {
            for (FunctionUnit fn : unit.functions()) {
                FunctionSite site = fn.site();
                try {
                    FunctionIR ir = transformer.transformFunction(site.node(), fn.cfg(), unit.file(),
                            site.namespace(), site.className());
                    cfgs.putIfAbsent(ir.id, fn.cfg());
                    callGraph.addFunction(site.name(), ProjectPaths.display(root, unit.file()),
                            site.className(), site.namespace(),
                            new FunctionFlags(site.info().isVirtual(), site.info().isStatic()));
                } catch (RuntimeException e) {
                    diagnostics.record(Diagnostic.Kind.UNIT_FAILURE, fn.cfg().functionName(),
                            "failed to transform: " + e.getMessage());
                }
            }
        }

        // 4. Calls, once every function is known
        for (FileUnit unit : units) {
            for (FunctionUnit fn : unit.functions()) {
                FunctionSite site = fn.site();
                callGraph.extractCalls(site.node(), site.name(), ProjectPaths.display(root, unit.file()),
                        site.className(), site.namespace());
            }
        }

        // 5. Modules and project
        System.err.println("[flowgraph] Transforming modules to IR...");
        Map<String, List<String>> functionsByModule = new LinkedHashMap<>();
        for (FunctionIR ir : transformer.getAllFunctions().values()) {
            Optional<String> module = moduleAnalysis.moduleForFile(root.resolve(ir.file));
            module.ifPresent(m -> functionsByModule.computeIfAbsent(m, k -> new ArrayList<>()).add(ir.id));
        }
        List<String> moduleIds = new ArrayList<>();
        for (ModuleInfo info : moduleAnalysis.modules().values()) {
            ModuleIR ir = transformer.transformModule(info.name(), info,
                    functionsByModule.getOrDefault(info.name(), List.of()));
            moduleIds.add(ir.id);
        }
        ProjectIR project = transformer.transformProject(config.getProjectName(root), moduleIds);

        System.err.println("[flowgraph] Analysis complete: "
                + transformer.getAllFunctions().size() + " functions, "
                + moduleIds.size() + " modules, "
                + diagnostics.size() + " diagnostics");

        return new AnalysisResult(
                new LinkedHashMap<>(transformer.getAllFunctions()),
                new LinkedHashMap<>(transformer.getAllModules()),
                project,
                cfgs,
                callGraph.callGraph(),
                moduleAnalysis,
                diagnostics.all());
    }

    private List<FileUnit> buildUnits(Path root, List<Path> files, Diagnostics diagnostics) {
        ExecutorService pool = Executors.newFixedThreadPool(config.getWorkerThreads());
        try {
            List<Future<FileUnit>> futures = new ArrayList<>();
            for (Path file : files) {
                futures.add(pool.submit(() -> buildUnit(root, file, diagnostics)));
            }
            List<FileUnit> units = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                try {
                    units.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    diagnostics.record(Diagnostic.Kind.UNIT_FAILURE, ProjectPaths.display(root, files.get(i)),
                            "failed to process: " + cause.getMessage());
                }
            }
            return units;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalysisException("Interrupted while analyzing files", e);
        } finally {
            pool.shutdownNow();
        }
    }

    private FileUnit buildUnit(Path root, Path file, Diagnostics diagnostics) {
        String display = ProjectPaths.display(root, file);
        Optional<SyntaxNode> tree = trees.treeFor(file);
        if (tree.isEmpty()) {
            diagnostics.record(Diagnostic.Kind.NOT_FOUND, display, "no syntax tree available");
            return new FileUnit(file, List.of());
        }
        List<FunctionUnit> functions = new ArrayList<>();
        for (FunctionSite site : SyntaxTrees.collectFunctions(tree.get())) {
            String qualified = CallGraphBuilder.qualify(site.name(), site.className(), site.namespace());
            try {
                functions.add(new FunctionUnit(site, cfgBuilder.build(site.node(), qualified, display)));
            } catch (RuntimeException e) {
                diagnostics.record(Diagnostic.Kind.UNIT_FAILURE, qualified, "failed to build CFG: " + e.getMessage());
            }
        }
        return new FileUnit(file, functions);
    }

    private record FunctionUnit(FunctionSite site, ControlFlowGraph cfg) {}

    private record FileUnit(Path file, List<FunctionUnit> functions) {}
}
