package com.flowgraph.analyzer.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Lookups over {@link SyntaxNode} trees.
 */
public final class SyntaxTrees {

    private SyntaxTrees() {}

    /**
     * Depth-first search for the first function whose decoded name equals {@code name}, or ends
     * with {@code ::name} for out-of-line definitions. An empty result is the NotFound outcome;
     * callers decide how to report it.
     */
    public static Optional<SyntaxNode> findFunction(SyntaxNode root, String name) {
        return findFirst(root, n -> n.function().map(f -> matchesName(f.name(), name)).orElse(false), true);
    }

    private static boolean matchesName(String declared, String name) {
        return declared != null && (declared.equals(name) || declared.endsWith("::" + name));
    }

    /** First descendant (not the node itself) of the given kind, in pre-order. */
    public static Optional<SyntaxNode> findDescendant(SyntaxNode node, String kind) {
        return findFirst(node, n -> kind.equals(n.kind()), false);
    }

    /** First direct child of the given kind. */
    public static Optional<SyntaxNode> child(SyntaxNode node, String kind) {
        for (SyntaxNode c : node.children()) {
            if (kind.equals(c.kind())) return Optional.of(c);
        }
        return Optional.empty();
    }

    /** Named, non-comment children. */
    public static List<SyntaxNode> namedChildren(SyntaxNode node) {
        List<SyntaxNode> result = new ArrayList<>();
        for (SyntaxNode c : node.children()) {
            if (c.isNamed() && !SyntaxKinds.COMMENT.equals(c.kind())) result.add(c);
        }
        return result;
    }

    /**
     * Collects every function definition with a decoded name, tracking the enclosing class and
     * namespace summaries. An out-of-line name like {@code Widget::draw} supplies its own class
     * when no class encloses the definition.
     */
    public static List<FunctionSite> collectFunctions(SyntaxNode root) {
        List<FunctionSite> sites = new ArrayList<>();
        collect(root, null, new ArrayDeque<>(), sites);
        return sites;
    }

    private static void collect(SyntaxNode node, String className, Deque<String> namespaces,
                                List<FunctionSite> sites) {
        String ns = node.namespaceName().filter(s -> !s.isBlank()).orElse(null);
        if (ns != null) namespaces.addLast(ns);
        String cls = node.className().filter(s -> !s.isBlank()).orElse(className);

        node.function()
            .filter(f -> f.name() != null && !f.name().isBlank())
            .ifPresent(f -> sites.add(toSite(node, f, cls, namespaces)));

        for (SyntaxNode child : node.children()) {
            collect(child, cls, namespaces, sites);
        }
        if (ns != null) namespaces.removeLast();
    }

    private static FunctionSite toSite(SyntaxNode node, FunctionInfo info, String cls, Deque<String> namespaces) {
        String name = info.name();
        int sep = name.lastIndexOf("::");
        if (sep > 0) {
            if (cls == null) cls = name.substring(0, sep);
            name = name.substring(sep + 2);
            info = new FunctionInfo(name, info.returnType(), info.parameters(),
                    info.isVirtual(), info.isStatic(), info.isConst());
        }
        String namespace = namespaces.isEmpty() ? null : String.join("::", namespaces);
        return new FunctionSite(node, info, cls, namespace);
    }

    private static Optional<SyntaxNode> findFirst(SyntaxNode start, Predicate<SyntaxNode> test, boolean includeStart) {
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        if (includeStart) {
            stack.push(start);
        } else {
            pushChildren(stack, start);
        }
        while (!stack.isEmpty()) {
            SyntaxNode n = stack.pop();
            if (test.test(n)) return Optional.of(n);
            pushChildren(stack, n);
        }
        return Optional.empty();
    }

    private static void pushChildren(Deque<SyntaxNode> stack, SyntaxNode node) {
        List<SyntaxNode> children = node.children();
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
        }
    }
}
