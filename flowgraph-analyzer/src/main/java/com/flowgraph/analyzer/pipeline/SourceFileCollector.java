package com.flowgraph.analyzer.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Walks a project for source files by extension, skipping excluded paths.
 *
 * An exclude pattern matches when, with every {@code *} removed, it is a substring of the
 * file's root-relative path written as {@code /a/b/c.cc}.
 */
public final class SourceFileCollector {

    private SourceFileCollector() {}

    /** Absolute, normalized paths in sorted order; empty when the root is not a directory. */
    public static List<Path> collect(Path projectRoot, List<String> extensions, List<String> excludePatterns) {
        Path root = projectRoot.toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) return List.of();

        List<String> suffixes = new ArrayList<>();
        for (String ext : extensions) {
            String e = ext.toLowerCase(Locale.ROOT);
            suffixes.add(e.startsWith(".") ? e : "." + e);
        }
        List<String> fragments = new ArrayList<>();
        for (String pattern : excludePatterns) {
            String f = pattern.replace("*", "");
            if (!f.isEmpty()) fragments.add(f);
        }

        try (Stream<Path> walk = Files.walk(root)) {
            return walk
                .filter(Files::isRegularFile)
                .map(p -> p.toAbsolutePath().normalize())
                .filter(p -> hasExtension(p, suffixes))
                .filter(p -> !isExcluded(root, p, fragments))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            System.err.println("[flowgraph] WARNING: could not walk source tree: " + e.getMessage());
            return List.of();
        }
    }

    private static boolean hasExtension(Path file, List<String> suffixes) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 && suffixes.contains(name.substring(dot).toLowerCase(Locale.ROOT));
    }

    private static boolean isExcluded(Path root, Path file, List<String> fragments) {
        String rel = "/" + root.relativize(file).toString().replace('\\', '/');
        for (String f : fragments) {
            if (rel.contains(f)) return true;
        }
        return false;
    }
}
