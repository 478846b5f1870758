package com.flowgraph.analyzer.call_graph;

import com.flowgraph.analyzer.syntax.SyntaxKinds;
import com.flowgraph.analyzer.syntax.SyntaxNode;
import com.flowgraph.analyzer.syntax.SyntaxTrees;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds call expressions in a syntax subtree.
 *
 * The callee of a {@code call_expression} is its first named child: an identifier or a
 * qualified identifier gives a direct call, a field expression gives a method call named by
 * its field identifier. Any other callee shape (function pointers, templates) is skipped.
 */
public final class CallSites {

    private CallSites() {}

    public static List<CallSite> collect(SyntaxNode root) {
        List<CallSite> result = new ArrayList<>();
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            if (SyntaxKinds.CALL_EXPRESSION.equals(node.kind())) {
                CallSite site = toCallSite(node);
                if (site != null) result.add(site);
            }
            List<SyntaxNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }

    /** Distinct callee names over several subtrees, in first-seen order. */
    public static Set<String> names(List<SyntaxNode> roots) {
        Set<String> names = new LinkedHashSet<>();
        for (SyntaxNode root : roots) {
            for (CallSite site : collect(root)) names.add(site.name());
        }
        return names;
    }

    private static CallSite toCallSite(SyntaxNode call) {
        List<SyntaxNode> named = SyntaxTrees.namedChildren(call);
        if (named.isEmpty()) return null;
        SyntaxNode callee = named.get(0);
        int line = call.span().line();
        switch (callee.kind()) {
            case SyntaxKinds.IDENTIFIER: {
                String name = callee.text().strip();
                return name.isEmpty() ? null : new CallSite(name, CallKind.DIRECT, line);
            }
            case SyntaxKinds.QUALIFIED_IDENTIFIER: {
                String text = callee.text().strip();
                int sep = text.lastIndexOf("::");
                String name = sep >= 0 ? text.substring(sep + 2) : text;
                return name.isEmpty() ? null : new CallSite(name, CallKind.DIRECT, line);
            }
            case SyntaxKinds.FIELD_EXPRESSION:
                return SyntaxTrees.child(callee, SyntaxKinds.FIELD_IDENTIFIER)
                        .map(f -> f.text().strip())
                        .filter(s -> !s.isEmpty())
                        .map(s -> new CallSite(s, CallKind.METHOD, line))
                        .orElse(null);
            default:
                return null;
        }
    }
}
