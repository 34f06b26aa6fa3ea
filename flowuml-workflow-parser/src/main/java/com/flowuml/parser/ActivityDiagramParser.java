package com.flowuml.parser;

import com.flowuml.model.WorkflowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Compiles an activity-diagram document ({@code @startuml ... @enduml}) into a
 * {@link WorkflowDefinition}.
 * <p>
 * Parsing is best effort: a statement that cannot be classified is skipped, and branches or loops
 * left open at the end of the document are closed as if their {@code endif} / {@code repeat while}
 * were present. {@link #parseWithDiagnostics} reports what was skipped or repaired. Only a document
 * that yields no nodes at all fails, with {@link WorkflowParseException}.
 * <p>
 * Instances hold no parse state and may be shared across threads.
 */
public final class ActivityDiagramParser {

    private static final Logger log = LoggerFactory.getLogger(ActivityDiagramParser.class);

    public static final String DEFAULT_WORKFLOW_NAME = "ImportedWorkflow";

    private final String defaultWorkflowName;

    public ActivityDiagramParser() {
        this(DEFAULT_WORKFLOW_NAME);
    }

    /**
     * @param defaultWorkflowName name given to definitions when neither a name nor a diagram
     *                            {@code title} is supplied; null = {@value #DEFAULT_WORKFLOW_NAME}
     */
    public ActivityDiagramParser(String defaultWorkflowName) {
        this.defaultWorkflowName = defaultWorkflowName != null && !defaultWorkflowName.isBlank()
                ? defaultWorkflowName
                : DEFAULT_WORKFLOW_NAME;
    }

    /**
     * Compiles the document.
     *
     * @param documentText   diagram text; must not be null
     * @param definitionId   id of the resulting definition; null = random UUID
     * @param definitionName name of the resulting definition; null = diagram title, else the default name
     * @return the compiled definition
     * @throws WorkflowParseException when the document yields no nodes
     */
    public WorkflowDefinition parse(String documentText, String definitionId, String definitionName) {
        return parseWithDiagnostics(documentText, definitionId, definitionName).definition();
    }

    /** Same as {@link #parse} but also returns diagnostics and the document's presentation settings. */
    public ParseResult parseWithDiagnostics(String documentText, String definitionId, String definitionName) {
        Objects.requireNonNull(documentText, "documentText");
        ParseSession session = new ParseSession(DiagramLexer.lines(documentText));
        session.run();
        ParseResult result = session.result(definitionId, definitionName, defaultWorkflowName);
        log.debug("Diagram parsed | definitionId={} | nodes={} | transitions={} | diagnostics={}",
                result.definition().getId(), result.definition().getNodes().size(),
                result.definition().getTransitions().size(), result.diagnostics().size());
        return result;
    }
}
