package com.flowuml.model;

import java.util.List;
import java.util.Objects;

/**
 * Renderable state of a workflow instance at its current node: either display text or a set of
 * choices. Derived on demand by the state calculator; never stored.
 */
public final class WorkflowStatePayload {

    private static final WorkflowStatePayload EMPTY = new WorkflowStatePayload(false, null, List.of(), null);

    private final boolean choice;
    private final String text;
    private final List<ChoiceOption> choices;
    private final String nodeLabel;

    private WorkflowStatePayload(boolean choice, String text, List<ChoiceOption> choices, String nodeLabel) {
        this.choice = choice;
        this.text = text;
        this.choices = choices != null ? List.copyOf(choices) : List.of();
        this.nodeLabel = nodeLabel;
    }

    public static WorkflowStatePayload text(String text, String nodeLabel) {
        return new WorkflowStatePayload(false, text, List.of(), nodeLabel);
    }

    public static WorkflowStatePayload choice(List<ChoiceOption> choices, String nodeLabel) {
        return new WorkflowStatePayload(true, null, choices, nodeLabel);
    }

    /** Payload for an unknown or unset current node. */
    public static WorkflowStatePayload empty() {
        return EMPTY;
    }

    public boolean isChoice() {
        return choice;
    }

    public String getText() {
        return text;
    }

    public List<ChoiceOption> getChoices() {
        return choices;
    }

    public String getNodeLabel() {
        return nodeLabel;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowStatePayload that = (WorkflowStatePayload) o;
        return choice == that.choice && Objects.equals(text, that.text)
                && choices.equals(that.choices) && Objects.equals(nodeLabel, that.nodeLabel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(choice, text, choices, nodeLabel);
    }

    @Override
    public String toString() {
        return choice ? "Choice" + choices : "Text{" + text + "}";
    }
}
