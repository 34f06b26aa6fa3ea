package com.flowuml.parser;

import java.util.Objects;

/**
 * A construct the parser skipped, repaired or adjusted while compiling a document. Diagnostics never
 * stop compilation; they let callers see what best-effort parsing did with malformed input.
 *
 * @param lineNumber 1-based line in the source text (the opening line for auto-closed constructs)
 * @param kind       category of the finding
 * @param message    human-readable description
 * @param line       trimmed source line the finding refers to
 */
public record ParseDiagnostic(int lineNumber, Kind kind, String message, String line) {

    public enum Kind {
        /** Line matched no statement and was skipped. */
        UNRECOGNIZED,
        /** Branch, loop, note or style block still open at a point where it had to be closed. */
        AUTO_CLOSED,
        /** Transition identical to an existing one (same source, target and condition) was dropped. */
        DUPLICATE_TRANSITION,
        /** Unconditioned self-transition was dropped. */
        SELF_TRANSITION_DROPPED,
        /** {@code else}, {@code endif} or {@code repeat while} without a matching open construct. */
        MISPLACED_KEYWORD,
        /** Note metadata before {@code |} looked like JSON but was not a JSON object; kept as note text. */
        INVALID_METADATA
    }

    public ParseDiagnostic {
        Objects.requireNonNull(kind, "kind");
        message = message != null ? message : "";
        line = line != null ? line : "";
    }

    @Override
    public String toString() {
        return "line " + lineNumber + " " + kind + ": " + message + (line.isEmpty() ? "" : " [" + line + "]");
    }
}
