package com.flowuml.engine.store;

import com.flowuml.model.WorkflowDefinition;

import java.util.Optional;
import java.util.Set;

/** Compiled definitions by id. Storing a definition under an existing id replaces it. */
public interface WorkflowDefinitionStore {

    void store(WorkflowDefinition definition);

    Optional<WorkflowDefinition> getById(String definitionId);

    boolean exists(String definitionId);

    /** Ids of the stored definitions, sorted. */
    Set<String> ids();
}
