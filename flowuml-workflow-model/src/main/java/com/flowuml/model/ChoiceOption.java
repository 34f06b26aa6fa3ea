package com.flowuml.model;

/**
 * One selectable option of a choice payload. {@code index} is the position of the underlying
 * transition among the node's outgoing transitions.
 */
public record ChoiceOption(
        int index,
        String displayText,
        String targetNodeId,
        String condition
) {
}
