package com.flowgraph.analyzer.call_graph;

import com.flowgraph.analyzer.resolve.Resolver;
import com.flowgraph.analyzer.resolve.ResolverChain;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Callee resolution strategies, tried in order: caller's class scope, caller's namespace scope,
 * then the bare name. Each only answers with a name that is already a registered function.
 */
public final class CalleeResolvers {

    private CalleeResolvers() {}

    /** The caller's own class, qualified by the caller's namespace when it has one. */
    public static Resolver<CalleeQuery> classScope(Predicate<String> known) {
        return q -> {
            if (q.callerClass() == null || q.callerClass().isEmpty()) return Optional.empty();
            String qualified = CallGraphBuilder.qualify(q.name(), q.callerClass(), q.callerNamespace());
            if (known.test(qualified)) return Optional.of(qualified);
            return scoped(q.callerClass(), q.name(), known);
        };
    }

    public static Resolver<CalleeQuery> namespaceScope(Predicate<String> known) {
        return q -> scoped(q.callerNamespace(), q.name(), known);
    }

    public static Resolver<CalleeQuery> bareName(Predicate<String> known) {
        return q -> known.test(q.name()) ? Optional.of(q.name()) : Optional.empty();
    }

    public static ResolverChain<CalleeQuery> defaultChain(Predicate<String> known) {
        return new ResolverChain<>(List.of(classScope(known), namespaceScope(known), bareName(known)));
    }

    private static Optional<String> scoped(String scope, String name, Predicate<String> known) {
        if (scope == null || scope.isEmpty()) return Optional.empty();
        String qualified = scope + "::" + name;
        return known.test(qualified) ? Optional.of(qualified) : Optional.empty();
    }
}
