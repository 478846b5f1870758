package com.flowgraph.analyzer.syntax;

/**
 * A function definition found in a syntax tree, with the class and namespace that enclose it.
 *
 * @param node        the function definition subtree
 * @param info        decoded summary; {@code info.name()} is the bare name
 * @param className   enclosing class, null at namespace or file scope
 * @param namespace   enclosing namespaces joined with {@code ::}, null at file scope
 */
public record FunctionSite(SyntaxNode node, FunctionInfo info, String className, String namespace) {

    public String name() {
        return info.name();
    }

    public int line() {
        return node.span().line();
    }
}
