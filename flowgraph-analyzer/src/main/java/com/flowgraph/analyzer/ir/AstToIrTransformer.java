package com.flowgraph.analyzer.ir;

import com.flowgraph.analyzer.cfg.CfgNode;
import com.flowgraph.analyzer.cfg.ControlFlowGraph;
import com.flowgraph.analyzer.diagnostics.Diagnostic;
import com.flowgraph.analyzer.diagnostics.Diagnostics;
import com.flowgraph.analyzer.ir.IrModel.FunctionIR;
import com.flowgraph.analyzer.ir.IrModel.IoParam;
import com.flowgraph.analyzer.ir.IrModel.MainFlow;
import com.flowgraph.analyzer.ir.IrModel.ModuleIR;
import com.flowgraph.analyzer.ir.IrModel.ProjectIR;
import com.flowgraph.analyzer.modules.ModuleAnalyzer;
import com.flowgraph.analyzer.modules.ModuleInfo;
import com.flowgraph.analyzer.modules.ProjectPaths;
import com.flowgraph.analyzer.syntax.FunctionInfo;
import com.flowgraph.analyzer.syntax.SyntaxNode;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns syntax summaries and CFGs into {@link FunctionIR}, then groups them into
 * {@link ModuleIR} and {@link ProjectIR}.
 *
 * The transformer keeps a registry of everything it produced, keyed by id, which the module
 * and project steps read back. A function whose id is already registered keeps the first
 * registration. Not thread-safe; the pipeline calls it from one thread.
 */
public class AstToIrTransformer {

    /** Bare function names that mark a module entry point. */
    public static final Set<String> ENTRY_POINT_NAMES = Set.of("main", "Main", "init", "Init", "start", "Start");

    private final Path projectRoot;
    private final Diagnostics diagnostics;
    private final Map<String, FunctionIR> functions = new LinkedHashMap<>();
    private final Map<String, ModuleIR> modules = new LinkedHashMap<>();

    public AstToIrTransformer(Path projectRoot, Diagnostics diagnostics) {
        this.projectRoot = ProjectPaths.normalize(projectRoot);
        this.diagnostics = diagnostics;
    }

    public AstToIrTransformer(Path projectRoot) {
        this(projectRoot, Diagnostics.silent());
    }

    /**
     * @param functionNode  function definition carrying a decoded {@code function} summary
     * @param cfg           graph built from the same subtree
     * @param file          source file, absolute or relative to the project root
     */
    public FunctionIR transformFunction(SyntaxNode functionNode, ControlFlowGraph cfg, Path file,
                                        String namespace, String className) {
        Optional<FunctionInfo> summary = functionNode.function();
        if (summary.isEmpty()) {
            diagnostics.record(Diagnostic.Kind.MALFORMED_INPUT, cfg.functionName(),
                    "function node carries no decoded summary");
        }
        FunctionInfo info = summary.orElse(FunctionInfo.of("unknown", "void"));
        String name = bareName(info.name());
        String returnType = info.returnType() == null || info.returnType().isBlank() ? "void" : info.returnType();

        FunctionIR ir = new FunctionIR();
        ir.id = IrIds.forFunction(namespace, className, name, ProjectPaths.stem(file.getFileName().toString()));
        ir.name = name;
        ir.file = ProjectPaths.display(projectRoot, file);
        ir.line = functionNode.span().line();
        ir.namespace = namespace;
        ir.className = className;

        List<String> params = new ArrayList<>();
        for (FunctionInfo.Parameter p : info.parameters()) {
            String type = p.type() == null ? "" : p.type();
            String pname = p.name() == null ? "" : p.name();
            ir.inputs.add(new IoParam(type, pname));
            params.add((type + " " + pname).strip());
        }
        ir.signature = IrIds.signature(returnType, name, params);
        if (!"void".equals(returnType)) ir.outputs.add(returnType);

        ir.controlBlocks = ControlBlockRecovery.recover(cfg);
        ir.calls = callsOf(cfg);
        ir.complexity = complexityOf(cfg);
        ir.metadata.addProperty("is_virtual", info.isVirtual());
        ir.metadata.addProperty("is_static", info.isStatic());
        ir.metadata.addProperty("is_const", info.isConst());

        FunctionIR existing = functions.putIfAbsent(ir.id, ir);
        if (existing != null) {
            diagnostics.record(Diagnostic.Kind.INTEGRITY_WARNING, ir.id,
                    "duplicate function id from " + ir.file + ":" + ir.line + "; keeping the first");
            return existing;
        }
        return ir;
    }

    /** {@code 1 + } the number of branch and loop nodes. */
    public static int complexityOf(ControlFlowGraph cfg) {
        int complexity = 1;
        for (CfgNode n : cfg.nodes()) {
            if (n.kind().isDecision()) complexity++;
        }
        return complexity;
    }

    /** Distinct callee names tagged on any node, sorted. */
    public static Set<String> callsOf(ControlFlowGraph cfg) {
        Set<String> calls = new TreeSet<>();
        for (CfgNode n : cfg.nodes()) {
            JsonElement tagged = n.attributes().get("calls");
            if (tagged == null || !tagged.isJsonArray()) continue;
            JsonArray names = tagged.getAsJsonArray();
            for (JsonElement e : names) calls.add(e.getAsString());
        }
        return new LinkedHashSet<>(calls);
    }

    /**
     * Partitions {@code functionIds} into public and private API and picks entry points. Ids
     * that were never transformed stay in {@code functions} but are otherwise ignored.
     */
    public ModuleIR transformModule(String name, ModuleInfo module, List<String> functionIds) {
        ModuleIR ir = new ModuleIR();
        ir.id = IrIds.forModule(name);
        ir.name = name;
        ir.path = module.path().toString();
        ir.functions = new ArrayList<>(functionIds);
        ir.dependencies = new LinkedHashSet<>(module.dependencies());

        for (String id : functionIds) {
            FunctionIR fn = functions.get(id);
            if (fn == null) {
                diagnostics.record(Diagnostic.Kind.NOT_FOUND, id, "function not transformed; module " + name);
                continue;
            }
            if (ModuleAnalyzer.isPublicPath(fn.file)) {
                ir.publicApi.add(id);
            } else {
                ir.privateApi.add(id);
            }
            if (ENTRY_POINT_NAMES.contains(fn.name)) {
                ir.entryPoints.add(id);
            }
        }

        ir.metadata.addProperty("file_count", module.files().size());
        ir.metadata.add("public_headers", displayAll(module.publicHeaders()));
        ir.metadata.add("source_files", displayAll(module.sourceFiles()));

        modules.put(ir.id, ir);
        return ir;
    }

    /** Main flows and the startup sequence, in {@code moduleIds} order. */
    public ProjectIR transformProject(String name, List<String> moduleIds) {
        ProjectIR ir = new ProjectIR();
        ir.id = IrIds.forProject(name);
        ir.name = name;
        ir.rootPath = projectRoot.toString();
        ir.modules = new ArrayList<>(moduleIds);

        for (String id : moduleIds) {
            ModuleIR module = modules.get(id);
            if (module == null) {
                diagnostics.record(Diagnostic.Kind.NOT_FOUND, id, "module not transformed");
                continue;
            }
            if (!module.entryPoints.isEmpty()) {
                ir.mainFlows.add(new MainFlow(id, module.entryPoints));
                ir.startupSequence.addAll(module.entryPoints);
            }
        }
        return ir;
    }

    public Optional<FunctionIR> getFunction(String id) {
        return Optional.ofNullable(functions.get(id));
    }

    public Optional<ModuleIR> getModule(String id) {
        return Optional.ofNullable(modules.get(id));
    }

    public Map<String, FunctionIR> getAllFunctions() {
        return Collections.unmodifiableMap(functions);
    }

    public Map<String, ModuleIR> getAllModules() {
        return Collections.unmodifiableMap(modules);
    }

    private JsonArray displayAll(List<Path> files) {
        JsonArray array = new JsonArray();
        for (Path f : files) array.add(ProjectPaths.display(projectRoot, f));
        return array;
    }

    private static String bareName(String name) {
        int sep = name.lastIndexOf("::");
        return sep >= 0 ? name.substring(sep + 2) : name;
    }
}
