package com.flowgraph.analyzer.cfg;

import java.util.Objects;

/**
 * A control-flow edge. {@code label} is optional text shown next to the edge.
 */
public record CfgEdge(String source, String target, CfgEdgeKind kind, String label) {

    public CfgEdge {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(kind, "kind");
    }

    public CfgEdge(String source, String target, CfgEdgeKind kind) {
        this(source, target, kind, null);
    }
}
