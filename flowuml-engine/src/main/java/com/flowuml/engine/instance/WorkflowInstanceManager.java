package com.flowuml.engine.instance;

import java.util.Map;
import java.util.Optional;

/**
 * Mutable runtime state of workflow instances: bound definition, current node and string variables
 * (names case-insensitive). Implementations must be safe for concurrent use; operations on one
 * instance never block operations on another.
 * <p>
 * Readers return empty for blank or unknown instance ids; writers reject blank ids with
 * {@link IllegalArgumentException}.
 */
public interface WorkflowInstanceManager {

    void bindDefinition(String instanceId, String definitionId);

    Optional<String> getDefinitionId(String instanceId);

    Optional<String> getCurrentNodeId(String instanceId);

    /** Sets the current node; the last writer wins. */
    void setCurrentNodeId(String instanceId, String nodeId);

    void clearCurrentNodeId(String instanceId);

    /**
     * Moves the instance to {@code nextNodeId} only if its current node is still {@code expectedNodeId}.
     *
     * @return true if the move happened
     */
    boolean compareAndSetCurrentNodeId(String instanceId, String expectedNodeId, String nextNodeId);

    Optional<String> getVariable(String instanceId, String name);

    void setVariable(String instanceId, String name, String value);

    /** Case-insensitive snapshot of the variables; later writes do not show up in it. */
    Map<String, String> getVariables(String instanceId);

    /**
     * Writes all updates under the instance lock so readers never see part of them.
     *
     * @throws IllegalArgumentException if any name is blank; nothing is written in that case
     */
    void applyVariableUpdates(String instanceId, Map<String, String> updates);

    void clearVariables(String instanceId);

    boolean exists(String instanceId);

    /** @return true if the instance existed */
    boolean remove(String instanceId);
}
