package com.flowgraph.analyzer;

import com.flowgraph.analyzer.config.AnalysisConfig;
import com.flowgraph.analyzer.pipeline.SourceFileCollector;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceFileCollectorTest {

    @TempDir
    Path root;

    private void touch(String relative) throws IOException {
        Path p = root.resolve(relative);
        Files.createDirectories(p.getParent());
        Files.writeString(p, "");
    }

    private List<String> relative(List<Path> files) {
        Path base = root.toAbsolutePath().normalize();
        return files.stream().map(p -> base.relativize(p).toString().replace('\\', '/')).toList();
    }

    @Test
    void collectsByExtensionAndSkipsExcludedDirectories() throws IOException {
        touch("core/engine.cc");
        touch("core/engine.h");
        touch("core/notes.txt");
        touch("build/gen.cc");
        touch("core/tests/engine_test.cc");
        touch("main.cpp");
        touch("util/Legacy.CC");

        List<Path> files = SourceFileCollector.collect(root,
                AnalysisConfig.DEFAULT_EXTENSIONS, AnalysisConfig.DEFAULT_EXCLUDE_PATTERNS);

        assertEquals(List.of("core/engine.cc", "core/engine.h", "main.cpp", "util/Legacy.CC"), relative(files));
        assertTrue(files.get(0).isAbsolute());
    }

    @Test
    void excludesMatchOnlyInsideTheProject() throws IOException {
        Path nested = Files.createDirectories(root.resolve("build/proj"));
        Files.createDirectories(nested.resolve("src"));
        Files.writeString(nested.resolve("src/a.cc"), "");

        List<Path> files = SourceFileCollector.collect(nested, List.of("cc"), List.of("**/build/**"));

        assertEquals(1, files.size());
    }

    @Test
    void missingRootYieldsNothing() {
        assertTrue(SourceFileCollector.collect(root.resolve("absent"), List.of(".cc"), List.of()).isEmpty());
    }
}
