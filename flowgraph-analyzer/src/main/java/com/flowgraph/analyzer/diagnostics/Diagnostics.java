package com.flowgraph.analyzer.diagnostics;

import java.util.ArrayList;
import java.util.List;

/**
 * Thread-safe collector of {@link Diagnostic}s for one analysis run.
 * Everything is recorded; only findings above low severity are echoed to stderr unless verbose.
 */
public class Diagnostics {

    private final List<Diagnostic> entries = new ArrayList<>();
    private final boolean verbose;
    private final boolean echo;

    public Diagnostics(boolean verbose) {
        this(verbose, true);
    }

    private Diagnostics(boolean verbose, boolean echo) {
        this.verbose = verbose;
        this.echo = echo;
    }

    /** Records without printing anything; for library callers and tests. */
    public static Diagnostics silent() {
        return new Diagnostics(false, false);
    }

    public void record(Diagnostic.Kind kind, String subject, String message) {
        Diagnostic d = new Diagnostic(kind, subject, message);
        synchronized (entries) {
            entries.add(d);
        }
        if (echo && (verbose || !kind.isLowSeverity())) {
            System.err.println("[flowgraph] WARNING: " + d);
        }
    }

    public List<Diagnostic> all() {
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }

    public List<Diagnostic> ofKind(Diagnostic.Kind kind) {
        List<Diagnostic> result = new ArrayList<>();
        for (Diagnostic d : all()) {
            if (d.kind() == kind) result.add(d);
        }
        return result;
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }
}
