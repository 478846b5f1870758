package com.flowgraph.analyzer.modules;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Supplies the text of a source file.
 */
@FunctionalInterface
public interface SourceProvider {

    String read(Path file) throws IOException;
}
