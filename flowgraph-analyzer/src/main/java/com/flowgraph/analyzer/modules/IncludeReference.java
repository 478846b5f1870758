package com.flowgraph.analyzer.modules;

import java.nio.file.Path;

/**
 * One {@code #include} literal of a file.
 *
 * @param targetModule module the literal resolved to, null when unresolved or dropped
 */
public record IncludeReference(Path file, String literal, int line, String targetModule) {

    public boolean isResolved() {
        return targetModule != null;
    }

    IncludeReference resolvedTo(String module) {
        return new IncludeReference(file, literal, line, module);
    }
}
