package com.flowuml.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Directed edge between two nodes, optionally guarded by a condition text. */
public final class Transition {

    private final String id;
    private final String fromNodeId;
    private final String toNodeId;
    private final String condition;

    @JsonCreator
    public Transition(
            @JsonProperty("id") String id,
            @JsonProperty("fromNodeId") String fromNodeId,
            @JsonProperty("toNodeId") String toNodeId,
            @JsonProperty("condition") String condition) {
        this.id = Objects.requireNonNull(id, "id");
        this.fromNodeId = Objects.requireNonNull(fromNodeId, "fromNodeId");
        this.toNodeId = Objects.requireNonNull(toNodeId, "toNodeId");
        this.condition = condition;
    }

    public String getId() {
        return id;
    }

    public String getFromNodeId() {
        return fromNodeId;
    }

    public String getToNodeId() {
        return toNodeId;
    }

    /** Guard text (e.g. branch condition or loop condition); null when unconditioned. */
    public String getCondition() {
        return condition;
    }

    @JsonIgnore
    public boolean hasCondition() {
        return condition != null && !condition.isBlank();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Transition that = (Transition) o;
        return id.equals(that.id) && fromNodeId.equals(that.fromNodeId)
                && toNodeId.equals(that.toNodeId) && Objects.equals(condition, that.condition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, fromNodeId, toNodeId, condition);
    }

    @Override
    public String toString() {
        return id + ": " + fromNodeId + " -> " + toNodeId + (condition != null ? " [" + condition + "]" : "");
    }
}
