package com.flowgraph.analyzer.ir;

import java.util.List;

/**
 * Generates deterministic IR ids and signature text:
 *   func_<namespace>_<class>_<name>_<file-stem>   (empty segments kept)
 *   module_<name>
 *   project_<name>
 * Every segment is sanitized to letters, digits, {@code _} and {@code -}.
 */
public final class IrIds {

    private IrIds() {}

    public static String forFunction(String namespace, String className, String name, String fileStem) {
        return create("func", nullToEmpty(namespace), nullToEmpty(className), name, fileStem);
    }

    public static String forModule(String name) {
        return create("module", name);
    }

    public static String forProject(String name) {
        return create("project", name);
    }

    public static String create(String prefix, String... parts) {
        StringBuilder sb = new StringBuilder(prefix);
        for (String part : parts) {
            sb.append('_').append(sanitize(part));
        }
        return sb.toString();
    }

    public static String sanitize(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            sb.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' ? c : '_');
        }
        return sb.toString();
    }

    /** {@code ret name(p1, p2)}, or {@code ret name(void)} without parameters. */
    public static String signature(String returnType, String name, List<String> params) {
        String joined = params.isEmpty() ? "void" : String.join(", ", params);
        return returnType + " " + name + "(" + joined + ")";
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
