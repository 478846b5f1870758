package com.flowgraph.analyzer.call_graph;

import com.google.gson.annotations.SerializedName;

/** How a callee was reached from its call site. */
public enum CallKind {
    /** Plain or namespace-qualified function call: {@code f()}, {@code ns::f()}. */
    @SerializedName("direct") DIRECT("direct"),
    /** Member call through an object or pointer: {@code obj.f()}, {@code ptr->f()}. */
    @SerializedName("method") METHOD("method");

    private final String wireName;

    CallKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
