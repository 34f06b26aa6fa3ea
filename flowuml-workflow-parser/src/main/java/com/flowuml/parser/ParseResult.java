package com.flowuml.parser;

import com.flowuml.model.WorkflowDefinition;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link ActivityDiagramParser#parseWithDiagnostics}: the compiled definition, what the
 * parser skipped or repaired along the way, and the document's presentation settings.
 */
public record ParseResult(WorkflowDefinition definition, List<ParseDiagnostic> diagnostics, DiagramProperties properties) {

    public ParseResult {
        Objects.requireNonNull(definition, "definition");
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
        properties = properties != null ? properties : new DiagramProperties(null, null, null, null);
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    public List<ParseDiagnostic> diagnostics(ParseDiagnostic.Kind kind) {
        return diagnostics.stream().filter(d -> d.kind() == kind).toList();
    }
}
