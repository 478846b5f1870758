package com.flowgraph.analyzer.cfg;

public record SourceLocation(String file, int line) {}
