package com.flowgraph.analyzer.resolve;

import java.util.List;
import java.util.Optional;

/**
 * Ordered list of {@link Resolver}s; the first strategy that finds a name wins.
 */
public final class ResolverChain<Q> implements Resolver<Q> {

    private final List<Resolver<Q>> strategies;

    public ResolverChain(List<Resolver<Q>> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    @Override
    public Optional<String> resolve(Q query) {
        for (Resolver<Q> strategy : strategies) {
            Optional<String> found = strategy.resolve(query);
            if (found.isPresent()) return found;
        }
        return Optional.empty();
    }

    public int size() {
        return strategies.size();
    }
}
