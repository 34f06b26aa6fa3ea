package com.flowuml.parser;

import java.util.List;

/**
 * Thrown when a document lacks the structure needed for a workflow at all (no nodes after
 * compilation). Carries the diagnostics gathered up to that point.
 */
public final class WorkflowParseException extends RuntimeException {

    private final List<ParseDiagnostic> diagnostics;

    public WorkflowParseException(String message, List<ParseDiagnostic> diagnostics) {
        super(message);
        this.diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }

    public List<ParseDiagnostic> getDiagnostics() {
        return diagnostics;
    }
}
