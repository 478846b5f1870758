package com.flowgraph.analyzer.modules;

import com.flowgraph.analyzer.diagnostics.Diagnostic;
import com.flowgraph.analyzer.diagnostics.Diagnostics;
import com.flowgraph.analyzer.graph.Attributes;
import com.flowgraph.analyzer.graph.Graph;
import com.flowgraph.analyzer.resolve.Resolver;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Groups files into modules by their top-level directory and derives module dependencies from
 * {@code #include} literals.
 *
 * An include resolves to the module of the first known file whose stem equals the literal's
 * stem, scanning modules and their files in insertion order. Absolute literals and literals
 * matching no file are dropped. A reference into the including file's own module is kept in
 * the file's references but never becomes a module edge.
 */
public class ModuleAnalyzer {

    static final Set<String> HEADER_EXTENSIONS = Set.of(".h", ".hpp", ".hh", ".hxx");

    private final Path projectRoot;
    private final SourceProvider sources;
    private final Diagnostics diagnostics;

    public ModuleAnalyzer(Path projectRoot, SourceProvider sources, Diagnostics diagnostics) {
        this.projectRoot = ProjectPaths.normalize(projectRoot);
        this.sources = sources;
        this.diagnostics = diagnostics;
    }

    public ModuleAnalyzer(Path projectRoot) {
        this(projectRoot, new FileSystemSourceProvider(), Diagnostics.silent());
    }

    /** Analyzes {@code files} from scratch; the analyzer keeps no state between runs. */
    public ModuleAnalysis analyze(List<Path> files) {
        Map<String, Accumulator> modules = new LinkedHashMap<>();
        Map<Path, String> fileToModule = new LinkedHashMap<>();

        for (Path f : files) {
            Path file = projectRoot.resolve(f).normalize();
            if (fileToModule.containsKey(file)) continue;
            String name = ProjectPaths.moduleName(projectRoot, file);
            Accumulator module = modules.computeIfAbsent(name, this::newModule);
            module.files.add(file);
            fileToModule.put(file, name);

            if (isHeader(file)) {
                if (isPublicPath(ProjectPaths.display(projectRoot, file))) {
                    module.publicHeaders.add(file);
                } else {
                    module.privateHeaders.add(file);
                }
            } else {
                module.sourceFiles.add(file);
            }
        }

        Resolver<String> stemResolver = literal -> resolveByStem(literal, modules);
        Map<Path, List<IncludeReference>> references = new LinkedHashMap<>();
        for (Accumulator module : modules.values()) {
            for (Path file : module.files) {
                List<IncludeReference> resolved = new ArrayList<>();
                for (IncludeReference ref : scan(file)) {
                    Optional<String> target = ref.literal().startsWith("/")
                            ? Optional.empty()
                            : stemResolver.resolve(ref.literal());
                    if (target.isEmpty()) {
                        diagnostics.record(Diagnostic.Kind.UNRESOLVED_REFERENCE, ref.literal(),
                                "include in " + ProjectPaths.display(projectRoot, file) + " matches no project file");
                        resolved.add(ref);
                        continue;
                    }
                    resolved.add(ref.resolvedTo(target.get()));
                    if (!target.get().equals(module.name)) {
                        module.dependencies.add(target.get());
                    }
                }
                references.put(file, resolved);
            }
        }

        Graph graph = new Graph();
        Map<String, ModuleInfo> infos = new LinkedHashMap<>();
        for (Accumulator module : modules.values()) {
            ModuleInfo info = module.freeze();
            infos.put(info.name(), info);
            graph.addNode(info.name(), Attributes.of(
                    "path", info.path().toString(),
                    "file_count", info.files().size()));
        }
        for (ModuleInfo info : infos.values()) {
            for (String dep : info.dependencies()) {
                graph.addEdge(info.name(), dep, Attributes.of("type", "depends_on"));
            }
        }
        return new ModuleAnalysis(infos, fileToModule, references, graph);
    }

    /** Whether a path carries one of the public-header markers. */
    public static boolean isPublicPath(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        return lower.contains("include") || lower.contains("public");
    }

    static boolean isHeader(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 && HEADER_EXTENSIONS.contains(name.substring(dot).toLowerCase(Locale.ROOT));
    }

    private List<IncludeReference> scan(Path file) {
        try {
            return IncludeScanner.scan(file, sources.read(file));
        } catch (IOException e) {
            diagnostics.record(Diagnostic.Kind.UNIT_FAILURE, ProjectPaths.display(projectRoot, file),
                    "cannot read for include scan: " + e.getMessage());
            return List.of();
        }
    }

    private static Optional<String> resolveByStem(String literal, Map<String, Accumulator> modules) {
        String stem = ProjectPaths.stem(literal);
        for (Accumulator module : modules.values()) {
            for (Path file : module.files) {
                if (ProjectPaths.stem(file.getFileName().toString()).equals(stem)) {
                    return Optional.of(module.name);
                }
            }
        }
        return Optional.empty();
    }

    private Accumulator newModule(String name) {
        boolean sentinel = ProjectPaths.ROOT_MODULE.equals(name) || ProjectPaths.UNKNOWN_MODULE.equals(name);
        return new Accumulator(name, sentinel ? projectRoot : projectRoot.resolve(name));
    }

    private static final class Accumulator {
        final String name;
        final Path path;
        final List<Path> files = new ArrayList<>();
        final List<Path> publicHeaders = new ArrayList<>();
        final List<Path> privateHeaders = new ArrayList<>();
        final List<Path> sourceFiles = new ArrayList<>();
        final Set<String> dependencies = new LinkedHashSet<>();

        Accumulator(String name, Path path) {
            this.name = name;
            this.path = path;
        }

        ModuleInfo freeze() {
            return new ModuleInfo(name, path, files, publicHeaders, privateHeaders, sourceFiles, dependencies);
        }
    }
}
