package com.flowgraph.analyzer.syntax;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of one node of a generic syntax tree produced by an external parser.
 * The analyzer never mutates a tree it is handed.
 */
public interface SyntaxNode {

    /** Grammar kind tag, e.g. {@code if_statement}. Anonymous tokens use their own text as kind. */
    String kind();

    Span span();

    /** Decoded source slice covered by this node. Never null, possibly empty. */
    String text();

    List<SyntaxNode> children();

    /**
     * Whether this is a named grammar node rather than punctuation or a keyword token.
     * Dumps that do not record it fall back to "kind differs from text".
     */
    default boolean isNamed() {
        return !kind().equals(text());
    }

    /** Decoded function summary attached by the parser to function definitions. */
    default Optional<FunctionInfo> function() {
        return Optional.empty();
    }

    /** Class name when this node is a class specifier the parser could name. */
    default Optional<String> className() {
        return Optional.empty();
    }

    /** Namespace name when this node is a namespace definition the parser could name. */
    default Optional<String> namespaceName() {
        return Optional.empty();
    }
}
