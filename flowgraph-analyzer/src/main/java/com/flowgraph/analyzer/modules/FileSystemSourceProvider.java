package com.flowgraph.analyzer.modules;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads files as UTF-8; undecodable bytes become replacement characters instead of failing.
 */
public class FileSystemSourceProvider implements SourceProvider {

    @Override
    public String read(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }
}
