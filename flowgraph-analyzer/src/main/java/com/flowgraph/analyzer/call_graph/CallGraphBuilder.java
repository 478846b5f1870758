package com.flowgraph.analyzer.call_graph;

import com.flowgraph.analyzer.diagnostics.Diagnostic;
import com.flowgraph.analyzer.diagnostics.Diagnostics;
import com.flowgraph.analyzer.graph.Attributes;
import com.flowgraph.analyzer.resolve.Resolver;
import com.flowgraph.analyzer.syntax.SyntaxNode;
import com.flowgraph.analyzer.syntax.SyntaxTrees;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Assembles the whole-program {@link CallGraph}.
 *
 * Functions are registered first; call extraction then resolves each bare callee name through
 * the ordered {@link CalleeResolvers} strategies. A callee no strategy resolves stays in the
 * graph as a bare, unregistered node, which is how external and library calls appear.
 */
public class CallGraphBuilder {

    private final CallGraph graph = new CallGraph();
    private final Resolver<CalleeQuery> resolver;
    private final Diagnostics diagnostics;

    public CallGraphBuilder(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
        this.resolver = CalleeResolvers.defaultChain(graph::isRegistered);
    }

    public CallGraphBuilder() {
        this(Diagnostics.silent());
    }

    /** {@code namespace::class::name} with absent or empty segments omitted. */
    public static String qualify(String name, String className, String namespace) {
        List<String> parts = new ArrayList<>(3);
        if (namespace != null && !namespace.isEmpty()) parts.add(namespace);
        if (className != null && !className.isEmpty()) parts.add(className);
        parts.add(name);
        return String.join("::", parts);
    }

    /** Registers a defined function and returns its qualified key. */
    public String addFunction(String name, String file, String className, String namespace, FunctionFlags flags) {
        FunctionFlags f = flags != null ? flags : FunctionFlags.NONE;
        String qualified = qualify(name, className, namespace);
        graph.addFunction(qualified, Attributes.of(
                "function_name", name,
                "class_name", className,
                "namespace", namespace,
                "file", file,
                "is_virtual", f.isVirtual(),
                "is_static", f.isStatic()));
        return qualified;
    }

    /**
     * Records the calls made by {@code functionName}, found under {@code subtree}.
     *
     * @return false when the function is not present in the subtree (recorded as NOT_FOUND)
     */
    public boolean extractCalls(SyntaxNode subtree, String functionName, String file,
                                String className, String namespace) {
        String caller = qualify(functionName, className, namespace);
        Optional<SyntaxNode> function = SyntaxTrees.findFunction(subtree, functionName);
        if (function.isEmpty()) {
            diagnostics.record(Diagnostic.Kind.NOT_FOUND, caller, "function not found in " + file);
            return false;
        }
        graph.addNode(caller, null);
        for (CallSite site : CallSites.collect(function.get())) {
            String callee = resolveCallee(site.name(), className, namespace);
            graph.addCall(caller, callee, site.kind());
        }
        return true;
    }

    /** Resolved qualified name, or the bare name when no registered function matches. */
    public String resolveCallee(String name, String callerClass, String callerNamespace) {
        Optional<String> resolved = resolver.resolve(new CalleeQuery(name, callerClass, callerNamespace));
        if (resolved.isPresent()) return resolved.get();
        diagnostics.record(Diagnostic.Kind.UNRESOLVED_REFERENCE, name,
                "no registered function; kept as external node");
        return name;
    }

    public List<String> callees(String name) {
        return graph.callees(name);
    }

    public List<String> callers(String name) {
        return graph.callers(name);
    }

    public List<String> topologicalOrder() {
        return graph.topologicalOrder();
    }

    public CallGraph callGraph() {
        return graph;
    }
}
