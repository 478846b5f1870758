package com.flowgraph.analyzer.syntax;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Supplies the syntax tree of a source file. Tree construction from raw text lives outside
 * the analyzer; implementations adapt whatever parser output is available.
 */
@FunctionalInterface
public interface SyntaxTreeProvider {

    /**
     * @return the tree for {@code sourceFile}, or empty when none exists for it
     * @throws SyntaxTreeReader.SyntaxTreeReadException when a tree exists but cannot be decoded
     */
    Optional<SyntaxNode> treeFor(Path sourceFile);
}
