package com.flowgraph.analyzer.call_graph;

/**
 * A bare callee name together with the caller's class and namespace context (both nullable).
 */
public record CalleeQuery(String name, String callerClass, String callerNamespace) {}
