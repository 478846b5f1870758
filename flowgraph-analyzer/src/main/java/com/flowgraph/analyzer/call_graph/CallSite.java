package com.flowgraph.analyzer.call_graph;

/**
 * A call expression found in a syntax subtree.
 *
 * @param name bare callee name, qualification stripped
 */
public record CallSite(String name, CallKind kind, int line) {}
