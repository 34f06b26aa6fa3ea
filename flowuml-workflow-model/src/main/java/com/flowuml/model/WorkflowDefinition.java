package com.flowuml.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Compiled workflow graph: nodes, transitions and start points. Read-only once constructed.
 * <p>
 * The constructor enforces referential integrity: node ids are unique, and every transition
 * endpoint and start point refers to an existing node. A violation means the producer (normally
 * the parser) is defective, so it fails fast with {@link IllegalArgumentException}.
 */
public final class WorkflowDefinition {

    private final String id;
    private final String name;
    private final List<WorkflowNode> nodes;
    private final List<Transition> transitions;
    private final List<StartPoint> startPoints;
    private final Map<String, WorkflowNode> nodesById;
    private final Map<String, List<Transition>> outgoingByNodeId;

    @JsonCreator
    public WorkflowDefinition(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("nodes") List<WorkflowNode> nodes,
            @JsonProperty("transitions") List<Transition> transitions,
            @JsonProperty("startPoints") List<StartPoint> startPoints) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name;
        this.nodes = nodes != null ? List.copyOf(nodes) : List.of();
        this.transitions = transitions != null ? List.copyOf(transitions) : List.of();
        this.startPoints = startPoints != null ? List.copyOf(startPoints) : List.of();

        Map<String, WorkflowNode> byId = new LinkedHashMap<>();
        for (WorkflowNode node : this.nodes) {
            if (byId.putIfAbsent(node.getId(), node) != null) {
                throw new IllegalArgumentException("Duplicate node id in definition " + id + ": " + node.getId());
            }
        }
        Map<String, List<Transition>> outgoing = new LinkedHashMap<>();
        for (Transition t : this.transitions) {
            requireNode(byId, t.getFromNodeId(), "transition " + t.getId() + " source");
            requireNode(byId, t.getToNodeId(), "transition " + t.getId() + " target");
            outgoing.computeIfAbsent(t.getFromNodeId(), k -> new ArrayList<>()).add(t);
        }
        for (StartPoint sp : this.startPoints) {
            requireNode(byId, sp.nodeId(), "start point");
        }
        outgoing.replaceAll((k, v) -> List.copyOf(v));
        this.nodesById = Collections.unmodifiableMap(byId);
        this.outgoingByNodeId = Collections.unmodifiableMap(outgoing);
    }

    private void requireNode(Map<String, WorkflowNode> byId, String nodeId, String what) {
        if (!byId.containsKey(nodeId)) {
            throw new IllegalArgumentException(
                    "Definition " + id + ": " + what + " references unknown node id '" + nodeId + "'");
        }
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    /** Nodes in creation order. */
    public List<WorkflowNode> getNodes() {
        return nodes;
    }

    /** Transitions in creation order. */
    public List<Transition> getTransitions() {
        return transitions;
    }

    public List<StartPoint> getStartPoints() {
        return startPoints;
    }

    public Optional<WorkflowNode> findNode(String nodeId) {
        if (nodeId == null) return Optional.empty();
        return Optional.ofNullable(nodesById.get(nodeId));
    }

    /** Outgoing transitions of the node in creation order; empty when none or unknown. */
    public List<Transition> outgoing(String nodeId) {
        if (nodeId == null) return List.of();
        return outgoingByNodeId.getOrDefault(nodeId, List.of());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowDefinition that = (WorkflowDefinition) o;
        return id.equals(that.id) && Objects.equals(name, that.name)
                && nodes.equals(that.nodes) && transitions.equals(that.transitions)
                && startPoints.equals(that.startPoints);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, nodes, transitions, startPoints);
    }
}
