package com.flowuml.action;

import com.flowuml.model.WorkflowDefinition;
import com.flowuml.model.WorkflowNode;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * What a handler sees of the running workflow: the instance, the node being executed, the definition
 * it belongs to, a snapshot of the instance variables taken when the dispatch started, and the
 * cancellation signal of the dispatch.
 */
public final class ActionHandlerContext {

    private final String instanceId;
    private final WorkflowNode node;
    private final WorkflowDefinition definition;
    private final Map<String, String> variables;
    private final CancellationSignal cancellation;

    public ActionHandlerContext(String instanceId, WorkflowNode node, WorkflowDefinition definition,
                                Map<String, String> variables, CancellationSignal cancellation) {
        this.instanceId = Objects.requireNonNull(instanceId, "instanceId");
        this.node = Objects.requireNonNull(node, "node");
        this.definition = Objects.requireNonNull(definition, "definition");
        TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (variables != null) copy.putAll(variables);
        this.variables = Collections.unmodifiableMap(copy);
        this.cancellation = cancellation != null ? cancellation : CancellationSignal.none();
    }

    public String getInstanceId() {
        return instanceId;
    }

    public WorkflowNode getNode() {
        return node;
    }

    public WorkflowDefinition getDefinition() {
        return definition;
    }

    /** Read-only, case-insensitive snapshot of the instance variables. */
    public Map<String, String> getVariables() {
        return variables;
    }

    public CancellationSignal getCancellation() {
        return cancellation;
    }
}
