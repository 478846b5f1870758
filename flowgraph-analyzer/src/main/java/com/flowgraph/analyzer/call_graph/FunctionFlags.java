package com.flowgraph.analyzer.call_graph;

public record FunctionFlags(boolean isVirtual, boolean isStatic) {

    public static final FunctionFlags NONE = new FunctionFlags(false, false);
}
