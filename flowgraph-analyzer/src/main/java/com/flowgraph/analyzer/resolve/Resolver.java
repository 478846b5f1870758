package com.flowgraph.analyzer.resolve;

import java.util.Optional;

/**
 * One resolution strategy: maps a query to a known name, or reports not-found.
 */
@FunctionalInterface
public interface Resolver<Q> {

    Optional<String> resolve(Q query);
}
