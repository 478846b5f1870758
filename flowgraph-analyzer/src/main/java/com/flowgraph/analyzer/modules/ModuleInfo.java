package com.flowgraph.analyzer.modules;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One module: its files split into public headers, private headers and sources, plus the
 * modules it depends on (never itself).
 */
public record ModuleInfo(
        String name,
        Path path,
        List<Path> files,
        List<Path> publicHeaders,
        List<Path> privateHeaders,
        List<Path> sourceFiles,
        Set<String> dependencies
) {
    public ModuleInfo {
        files = List.copyOf(files);
        publicHeaders = List.copyOf(publicHeaders);
        privateHeaders = List.copyOf(privateHeaders);
        sourceFiles = List.copyOf(sourceFiles);
        dependencies = Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
    }
}
