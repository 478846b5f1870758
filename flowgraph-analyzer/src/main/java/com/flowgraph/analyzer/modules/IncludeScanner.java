package com.flowgraph.analyzer.modules;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Textual scan for {@code #include "x"} and {@code #include <x>} literals.
 */
public final class IncludeScanner {

    static final Pattern INCLUDE = Pattern.compile("#include\\s+[<\"]([^>\"]+)[>\"]");

    private IncludeScanner() {}

    public static List<IncludeReference> scan(Path file, String content) {
        List<IncludeReference> refs = new ArrayList<>();
        Matcher m = INCLUDE.matcher(content);
        while (m.find()) {
            refs.add(new IncludeReference(file, m.group(1), lineOf(content, m.start()), null));
        }
        return refs;
    }

    private static int lineOf(String content, int offset) {
        int line = 1;
        for (int i = 0; i < offset; i++) {
            if (content.charAt(i) == '\n') line++;
        }
        return line;
    }
}
