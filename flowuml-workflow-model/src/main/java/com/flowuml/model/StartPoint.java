package com.flowuml.model;

import java.util.Objects;

/** Marks the entry node of a definition. */
public record StartPoint(String nodeId) {
    public StartPoint {
        Objects.requireNonNull(nodeId, "nodeId");
    }
}
