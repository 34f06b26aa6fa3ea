package com.flowuml.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowuml.model.ChoiceOption;
import com.flowuml.model.StartPoint;
import com.flowuml.model.Transition;
import com.flowuml.model.WorkflowDefinition;
import com.flowuml.model.WorkflowNode;
import com.flowuml.model.WorkflowStatePayload;
import com.flowuml.model.json.JsonObjects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Derives where an instance starts and what it shows at a node. Stateless; reads only the
 * (immutable) definition, so it is safe to call from any thread.
 */
public final class WorkflowStateCalculator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowStateCalculator.class);

    private static final String START_LABEL = "start";
    private static final String ACTION_TEXT_PREFIX = "Action: ";

    private WorkflowStateCalculator() {
    }

    /**
     * Entry node of a new instance: the first start point, else the first node. When that node is a
     * structural marker (blank label or {@code start}) with exactly one outgoing transition, the
     * target of that transition is returned instead. Only one hop is taken.
     *
     * @return the node id, or empty when the definition has no nodes
     */
    public static Optional<String> calculateStartNode(WorkflowDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        Optional<String> declared = declaredStartNode(definition);
        if (declared.isEmpty()) {
            return Optional.empty();
        }
        String startId = declared.get();
        String label = definition.findNode(startId).map(WorkflowNode::getLabel).orElse("");
        List<Transition> outgoing = definition.outgoing(startId);
        if (outgoing.size() == 1 && (label.isBlank() || START_LABEL.equalsIgnoreCase(label.trim()))) {
            String target = outgoing.get(0).getToNodeId();
            log.debug("Start node advanced | definitionId={} | from={} | to={}", definition.getId(), startId, target);
            return Optional.of(target);
        }
        return declared;
    }

    /** First start point, else first node, without the single-hop advance. */
    public static Optional<String> declaredStartNode(WorkflowDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        List<StartPoint> startPoints = definition.getStartPoints();
        if (!startPoints.isEmpty()) {
            return Optional.of(startPoints.get(0).nodeId());
        }
        List<WorkflowNode> nodes = definition.getNodes();
        return nodes.isEmpty() ? Optional.empty() : Optional.of(nodes.get(0).getId());
    }

    /**
     * Renderable state at the given node. A node with more than one outgoing transition, or with a
     * single guarded one, is a choice; everything else is text. Unknown or null node ids give
     * {@link WorkflowStatePayload#empty()}.
     */
    public static WorkflowStatePayload calculateCurrentPayload(WorkflowDefinition definition, String currentNodeId) {
        Objects.requireNonNull(definition, "definition");
        Optional<WorkflowNode> found = definition.findNode(currentNodeId);
        if (found.isEmpty()) {
            return WorkflowStatePayload.empty();
        }
        WorkflowNode node = found.get();
        List<Transition> outgoing = definition.outgoing(node.getId());
        if (isChoice(outgoing)) {
            List<ChoiceOption> options = new ArrayList<>(outgoing.size());
            for (int i = 0; i < outgoing.size(); i++) {
                Transition t = outgoing.get(i);
                options.add(new ChoiceOption(i, displayText(definition, t.getToNodeId()), t.getToNodeId(), t.getCondition()));
            }
            return WorkflowStatePayload.choice(options, node.getLabel());
        }
        return WorkflowStatePayload.text(displayText(node), node.getLabel());
    }

    static boolean isChoice(List<Transition> outgoing) {
        return outgoing.size() > 1 || (outgoing.size() == 1 && outgoing.get(0).hasCondition());
    }

    private static String displayText(WorkflowDefinition definition, String targetId) {
        String label = definition.findNode(targetId).map(WorkflowNode::getLabel).orElse("");
        return label.isBlank() ? targetId : label;
    }

    private static String displayText(WorkflowNode node) {
        String note = node.getNoteMarkdown();
        if (note == null || note.isBlank()) {
            return node.getLabel();
        }
        Optional<ObjectNode> json = JsonObjects.tryParseObject(note);
        if (json.isPresent() && JsonObjects.hasActionKey(json.get())) {
            return JsonObjects.actionName(json.get())
                    .map(name -> ACTION_TEXT_PREFIX + name)
                    .orElse(note);
        }
        return note;
    }
}
