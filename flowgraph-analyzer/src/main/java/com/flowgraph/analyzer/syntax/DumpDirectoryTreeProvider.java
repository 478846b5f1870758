package com.flowgraph.analyzer.syntax;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Resolves {@code <projectRoot>/a/b.cc} to the dump {@code <treesDir>/a/b.cc.json}.
 */
public class DumpDirectoryTreeProvider implements SyntaxTreeProvider {

    private final Path projectRoot;
    private final Path treesDir;
    private final SyntaxTreeReader reader = new SyntaxTreeReader();

    public DumpDirectoryTreeProvider(Path projectRoot, Path treesDir) {
        this.projectRoot = projectRoot.toAbsolutePath().normalize();
        this.treesDir = treesDir;
    }

    @Override
    public Optional<SyntaxNode> treeFor(Path sourceFile) {
        Path dump = dumpPathFor(sourceFile);
        if (!Files.isRegularFile(dump)) {
            return Optional.empty();
        }
        return Optional.of(reader.read(dump));
    }

    Path dumpPathFor(Path sourceFile) {
        Path absolute = sourceFile.toAbsolutePath().normalize();
        Path relative = absolute.startsWith(projectRoot)
                ? projectRoot.relativize(absolute)
                : absolute.getFileName();
        return treesDir.resolve(relative.toString() + ".json");
    }
}
