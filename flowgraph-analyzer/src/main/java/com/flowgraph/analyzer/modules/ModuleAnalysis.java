package com.flowgraph.analyzer.modules;

import com.flowgraph.analyzer.graph.Graph;
import com.flowgraph.analyzer.graph.GraphUtils;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of one {@link ModuleAnalyzer#analyze} run.
 */
public final class ModuleAnalysis {

    private final Map<String, ModuleInfo> modules;
    private final Map<Path, String> fileToModule;
    private final Map<Path, List<IncludeReference>> references;
    private final Graph moduleGraph;

    ModuleAnalysis(Map<String, ModuleInfo> modules, Map<Path, String> fileToModule,
                   Map<Path, List<IncludeReference>> references, Graph moduleGraph) {
        this.modules = Collections.unmodifiableMap(new LinkedHashMap<>(modules));
        this.fileToModule = Collections.unmodifiableMap(new LinkedHashMap<>(fileToModule));
        Map<Path, List<IncludeReference>> refs = new LinkedHashMap<>();
        references.forEach((k, v) -> refs.put(k, List.copyOf(v)));
        this.references = Collections.unmodifiableMap(refs);
        this.moduleGraph = moduleGraph;
    }

    /** Modules in first-seen file order. */
    public Map<String, ModuleInfo> modules() {
        return modules;
    }

    public Optional<ModuleInfo> module(String name) {
        return Optional.ofNullable(modules.get(name));
    }

    /**
     * Module dependency graph. Nodes carry {@code path} and {@code file_count}; edges carry
     * {@code type = depends_on}. Each call returns a fresh copy.
     */
    public Graph moduleGraph() {
        return GraphUtils.prune(moduleGraph, moduleGraph.nodeIds());
    }

    public Optional<String> moduleForFile(Path file) {
        return Optional.ofNullable(fileToModule.get(ProjectPaths.normalize(file)));
    }

    public List<String> dependencies(String module) {
        return moduleGraph.hasNode(module) ? moduleGraph.successors(module) : List.of();
    }

    public List<String> dependents(String module) {
        return moduleGraph.hasNode(module) ? moduleGraph.predecessors(module) : List.of();
    }

    /**
     * Include literals of one file that resolved to a module, including references into the
     * file's own module.
     */
    public List<IncludeReference> fileReferences(Path file) {
        List<IncludeReference> refs = references.get(ProjectPaths.normalize(file));
        if (refs == null) return List.of();
        List<IncludeReference> resolved = new ArrayList<>();
        for (IncludeReference r : refs) {
            if (r.isResolved()) resolved.add(r);
        }
        return resolved;
    }
}
