package com.flowuml.engine;

import com.flowuml.model.Transition;
import com.flowuml.model.WorkflowDefinition;
import com.flowuml.model.WorkflowNode;

import java.util.List;
import java.util.Optional;

/** Maps a user's choice value to the target of one of the current node's outgoing transitions. */
final class ChoiceResolver {

    private ChoiceResolver() {
    }

    static Optional<String> resolve(List<Transition> outgoing, WorkflowDefinition definition, Object choiceValue) {
        if (outgoing.isEmpty()) {
            return Optional.empty();
        }
        if (choiceValue == null) {
            return outgoing.size() == 1 ? Optional.of(outgoing.get(0).getToNodeId()) : Optional.empty();
        }
        if (choiceValue instanceof Integer index) {
            return byIndex(outgoing, index);
        }
        if (choiceValue instanceof String value) {
            for (Transition t : outgoing) {
                if (t.getToNodeId().equals(value)) return Optional.of(t.getToNodeId());
            }
            for (Transition t : outgoing) {
                String label = definition.findNode(t.getToNodeId()).map(WorkflowNode::getLabel).orElse(null);
                if (value.equals(label)) return Optional.of(t.getToNodeId());
            }
            try {
                return byIndex(outgoing, Integer.parseInt(value.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static Optional<String> byIndex(List<Transition> outgoing, int index) {
        if (index < 0 || index >= outgoing.size()) return Optional.empty();
        return Optional.of(outgoing.get(index).getToNodeId());
    }
}
