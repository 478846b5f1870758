package com.flowgraph.analyzer.diagnostics;

/**
 * A non-fatal finding recorded during analysis.
 *
 * @param subject the function, file or reference the finding is about
 */
public record Diagnostic(Kind kind, String subject, String message) {

    public enum Kind {
        /** A requested function or module is absent from the analysis. */
        NOT_FOUND,
        /** Input with an unexpected shape; degraded rather than rejected. */
        MALFORMED_INPUT,
        /** A call or include the resolvers could not map. */
        UNRESOLVED_REFERENCE,
        /** Orphans, duplicates or cycles in produced structures. */
        INTEGRITY_WARNING,
        /** A file or function whose processing failed and was skipped. */
        UNIT_FAILURE;

        /** Whether the kind is worth printing without verbose output. */
        public boolean isLowSeverity() {
            return this == UNRESOLVED_REFERENCE || this == NOT_FOUND;
        }
    }

    @Override
    public String toString() {
        return kind + " " + subject + ": " + message;
    }
}
