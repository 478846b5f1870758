package com.flowgraph.analyzer.modules;

import java.nio.file.Path;

/**
 * Module partitioning and path display relative to a project root.
 */
public final class ProjectPaths {

    /** Module of files sitting directly in the project root. */
    public static final String ROOT_MODULE = "root";
    /** Module of files outside the project root. */
    public static final String UNKNOWN_MODULE = "unknown";

    private ProjectPaths() {}

    /** First path segment relative to {@code root}, or one of the two sentinels. */
    public static String moduleName(Path root, Path file) {
        Path base = normalize(root);
        Path abs = base.resolve(file).normalize();
        if (!abs.startsWith(base)) return UNKNOWN_MODULE;
        Path rel = base.relativize(abs);
        if (rel.getNameCount() <= 1) return ROOT_MODULE;
        return rel.getName(0).toString();
    }

    /** Root-relative path with {@code /} separators; absolute for files outside the root. */
    public static String display(Path root, Path file) {
        Path base = normalize(root);
        Path abs = base.resolve(file).normalize();
        if (!abs.startsWith(base)) return abs.toString();
        return base.relativize(abs).toString().replace('\\', '/');
    }

    public static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }

    /** File name without its last extension. */
    public static String stem(String fileName) {
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        String name = fileName.substring(slash + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
